package com.verlumen.ideasearch.vectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.ideasearch.graph.NodeType;
import java.util.Optional;

/**
 * Stores one vector per node id, labelled with the node type and the ids of the contexts the node
 * has been tested in. Every method may throw {@link
 * com.verlumen.ideasearch.errors.StoreUnavailableException}.
 */
public interface VectorIndex {
  /** Inserts or replaces the vector for {@code id}. Context tags of an existing entry are kept. */
  void upsert(String id, double[] vector, NodeType nodeType);

  /** Records that the node was tested in the given context. Unknown ids are rejected. */
  void tagContext(String id, String contextId);

  boolean remove(String id);

  boolean contains(String id);

  ImmutableSet<String> ids();

  /**
   * Returns up to {@code topK} entries of {@code nodeType}, optionally limited to entries tagged
   * with {@code contextId}, ordered by descending cosine similarity and then ascending id.
   */
  ImmutableList<SimilarityMatch> query(
      double[] vector, NodeType nodeType, Optional<String> contextId, int topK);
}
