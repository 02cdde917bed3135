package com.verlumen.ideasearch.vectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import com.verlumen.ideasearch.graph.NodeType;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Flat vector array searched by brute force. Thread safe. */
final class InMemoryVectorIndex implements VectorIndex {
  private static final Comparator<SimilarityMatch> RANKING =
      Comparator.comparingDouble(SimilarityMatch::similarity)
          .reversed()
          .thenComparing(SimilarityMatch::id);

  private final Map<String, Entry> entries = new HashMap<>();
  private final int dimension;

  @Inject
  InMemoryVectorIndex(EmbeddingProvider embeddings) {
    this.dimension = embeddings.dimension();
  }

  @Override
  public synchronized void upsert(String id, double[] vector, NodeType nodeType) {
    checkNotNull(id, "Vector id cannot be null");
    checkDimension(vector);
    Entry existing = entries.get(id);
    Set<String> contextIds = existing == null ? new HashSet<>() : existing.contextIds;
    entries.put(id, new Entry(vector.clone(), nodeType, contextIds));
  }

  @Override
  public synchronized void tagContext(String id, String contextId) {
    Entry entry = entries.get(id);
    checkArgument(entry != null, "No vector stored for %s", id);
    entry.contextIds.add(contextId);
  }

  @Override
  public synchronized boolean remove(String id) {
    return entries.remove(id) != null;
  }

  @Override
  public synchronized boolean contains(String id) {
    return entries.containsKey(id);
  }

  @Override
  public synchronized ImmutableSet<String> ids() {
    return ImmutableSet.copyOf(entries.keySet());
  }

  @Override
  public synchronized ImmutableList<SimilarityMatch> query(
      double[] vector, NodeType nodeType, Optional<String> contextId, int topK) {
    checkArgument(topK > 0, "topK must be positive: %s", topK);
    checkDimension(vector);
    return entries.entrySet().stream()
        .filter(entry -> entry.getValue().nodeType == nodeType)
        .filter(entry -> contextId.map(entry.getValue().contextIds::contains).orElse(true))
        .map(
            entry ->
                SimilarityMatch.create(
                    entry.getKey(), VectorMath.cosine(vector, entry.getValue().vector)))
        .sorted(RANKING)
        .limit(topK)
        .collect(toImmutableList());
  }

  private void checkDimension(double[] vector) {
    checkArgument(
        vector.length == dimension,
        "Expected a vector of dimension %s, got %s",
        dimension,
        vector.length);
  }

  private static final class Entry {
    private final double[] vector;
    private final NodeType nodeType;
    private final Set<String> contextIds;

    private Entry(double[] vector, NodeType nodeType, Set<String> contextIds) {
      this.vector = vector;
      this.nodeType = nodeType;
      this.contextIds = contextIds;
    }
  }
}
