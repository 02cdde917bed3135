package com.verlumen.ideasearch.memory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.ideasearch.graph.Backtest;
import com.verlumen.ideasearch.graph.Context;
import com.verlumen.ideasearch.graph.GraphSnapshot;
import com.verlumen.ideasearch.graph.Idea;
import com.verlumen.ideasearch.graph.NodeType;
import com.verlumen.ideasearch.graph.Scenario;
import com.verlumen.ideasearch.graph.Subject;
import com.verlumen.ideasearch.vectors.SimilarityMatch;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Knowledge store of ideas, scenarios, contexts and backtests that keeps a graph store and a vector
 * index consistent with each other. This is the only component that writes to either store.
 *
 * <p>Writes are serialized and all-or-nothing: a failed write leaves both stores as they were.
 * Calls that find a store unavailable are retried with backoff before the {@link
 * com.verlumen.ideasearch.errors.StoreUnavailableException} is surfaced. Reads are not locked and
 * may observe a write in progress.
 *
 * <p>Malformed input raises {@link com.verlumen.ideasearch.errors.ValidationException}; a reference
 * to a missing node raises {@link com.verlumen.ideasearch.errors.NotFoundException}.
 */
public interface HybridMemory {
  /** Stores a new root idea and returns its id. */
  String addIdea(String description, Set<String> tags);

  /** Stores a scenario refining {@code parentId}, which must be an idea or a scenario. */
  String addScenario(String description, String parentId, Set<String> tags);

  String addContext(String market, String timeframe, String description);

  /**
   * Records a backtest of {@code subjectId} run in {@code contextId}, optionally applying to a
   * scenario, and credits the subject with one test and the backtest's score.
   */
  String addBacktest(
      String subjectId,
      String contextId,
      Map<String, Double> metrics,
      String notes,
      Optional<String> scenarioId);

  /**
   * Records the outcome of simulating a scenario. The backtest applies to the scenario and its
   * score is credited to the scenario and to every SUBIDEA_OF ancestor in one write.
   */
  String recordSimulation(
      String scenarioId, String contextId, Map<String, Double> metrics, String notes);

  /** Nodes of {@code nodeType} most similar to {@code text}, best first, ties by id. */
  ImmutableList<SimilarityMatch> findSimilar(String text, NodeType nodeType, int topK);

  /** As {@link #findSimilar(String, NodeType, int)}, limited to nodes tested in a context. */
  ImmutableList<SimilarityMatch> findSimilar(
      String text, NodeType nodeType, String contextId, int topK);

  /**
   * Ideas and scenarios ranked by the average of {@code metricName} over their backtests. A
   * backtest without the metric counts as 0 and untested subjects are left out.
   */
  ImmutableList<MetricRanking> bestByMetric(String metricName, int topK);

  /** Every node within {@code depth} hops of the root, following edges in both directions. */
  GraphSnapshot getSubgraph(String rootId, int depth);

  Optional<Idea> getIdea(String id);

  Optional<Scenario> getScenario(String id);

  Optional<Context> getContext(String id);

  Optional<Backtest> getBacktest(String id);

  Optional<Subject> getSubject(String id);

  ImmutableList<Idea> listIdeas();

  /** Scenarios directly refining {@code parentId}, ordered by id. */
  ImmutableList<Scenario> childrenOf(String parentId);

  Optional<Subject> parentOf(String scenarioId);

  /** SUBIDEA_OF ancestors of the node, nearest first. */
  ImmutableList<Subject> ancestorsOf(String nodeId);

  /** Backtests of the subject, optionally limited to one context, oldest first. */
  ImmutableList<Backtest> backtestsFor(String subjectId, Optional<String> contextId);

  ImmutableList<Backtest> backtestsApplyingTo(String scenarioId);

  Optional<Context> findContext(String market, String timeframe);

  SubjectPerformance performanceOf(String subjectId);

  /**
   * Suggests stored ideas and scenarios for {@code text}. Similar subjects that have been tested
   * come first, best mean score first, followed by untested ones by similarity.
   */
  ImmutableList<Recommendation> recommend(String text, Optional<String> contextId, int topK);

  /**
   * Moves a scenario under a new parent and rebuilds the counters.
   *
   * @throws com.verlumen.ideasearch.errors.CycleException if the new parent is the scenario itself
   *     or one of its descendants
   */
  void reparentScenario(String scenarioId, String newParentId);

  /** Deletes a scenario that has neither children nor backtests. */
  void discardScenario(String scenarioId);

  /** Recomputes every counter from the stored backtests and returns how many changed. */
  int rebuildStatistics();

  /**
   * Repairs what failed rollbacks left behind. Backtests flagged in {@link #orphanedIds()} are
   * removed and counters rebuilt; graph nodes missing from the vector index are embedded and
   * vectors without a graph node are dropped. Returns the number of repairs. Only flags whose id
   * is consistent afterwards are cleared.
   */
  int reconcileIndex();

  /** Ids left inconsistent by a rollback that itself failed. */
  ImmutableSet<String> orphanedIds();
}
