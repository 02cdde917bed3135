package com.verlumen.ideasearch.memory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.nullToEmpty;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.ideasearch.errors.CycleException;
import com.verlumen.ideasearch.errors.NotFoundException;
import com.verlumen.ideasearch.errors.ValidationException;
import com.verlumen.ideasearch.graph.Backtest;
import com.verlumen.ideasearch.graph.Context;
import com.verlumen.ideasearch.graph.GraphSnapshot;
import com.verlumen.ideasearch.graph.GraphSnapshot.SnapshotNode;
import com.verlumen.ideasearch.graph.GraphStore;
import com.verlumen.ideasearch.graph.Idea;
import com.verlumen.ideasearch.graph.NodeType;
import com.verlumen.ideasearch.graph.Relationship;
import com.verlumen.ideasearch.graph.RelationshipType;
import com.verlumen.ideasearch.graph.Scenario;
import com.verlumen.ideasearch.graph.Subject;
import com.verlumen.ideasearch.scoring.ScoreFunction;
import com.verlumen.ideasearch.vectors.EmbeddingProvider;
import com.verlumen.ideasearch.vectors.SimilarityMatch;
import com.verlumen.ideasearch.vectors.VectorIndex;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

final class HybridMemoryImpl implements HybridMemory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final double SCORE_TOLERANCE = 1e-9;
  private static final Comparator<Backtest> BY_DATE =
      Comparator.comparing(Backtest::date).thenComparing(Backtest::id);
  private static final Comparator<MetricRanking> BY_VALUE =
      Comparator.comparingDouble(MetricRanking::value)
          .reversed()
          .thenComparing(MetricRanking::subjectId);
  private static final Comparator<Recommendation> BY_MEAN_SCORE =
      Comparator.comparingDouble(Recommendation::meanScore)
          .thenComparingDouble(Recommendation::similarity)
          .reversed()
          .thenComparing(Recommendation::subjectId);
  private static final Comparator<Recommendation> BY_SIMILARITY =
      Comparator.comparingDouble(Recommendation::similarity)
          .reversed()
          .thenComparing(Recommendation::subjectId);

  private final GraphStore graph;
  private final VectorIndex vectors;
  private final EmbeddingProvider embeddings;
  private final ScoreFunction scoreFunction;
  private final Clock clock;
  private final Retry storeRetry;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final Set<String> orphanedIds = ConcurrentHashMap.newKeySet();

  @Inject
  HybridMemoryImpl(
      GraphStore graph,
      VectorIndex vectors,
      EmbeddingProvider embeddings,
      ScoreFunction scoreFunction,
      Clock clock,
      Retry storeRetry) {
    this.graph = graph;
    this.vectors = vectors;
    this.embeddings = embeddings;
    this.scoreFunction = scoreFunction;
    this.clock = clock;
    this.storeRetry = storeRetry;
  }

  @Override
  public String addIdea(String description, Set<String> tags) {
    requireText(description, "Idea description");
    Idea idea =
        Idea.builder()
            .setId(newId("idea"))
            .setDescription(description)
            .setTags(ImmutableSet.copyOf(tags))
            .setCreatedAt(clock.instant())
            .build();

    writeLock.lock();
    try {
      storeNode(idea.id(), NodeType.IDEA, idea.description(), () -> graph.putIdea(idea));
    } finally {
      writeLock.unlock();
    }
    logger.atInfo().log("Added idea %s: %s", idea.id(), idea.description());
    return idea.id();
  }

  @Override
  public String addScenario(String description, String parentId, Set<String> tags) {
    requireText(description, "Scenario description");
    Scenario scenario =
        Scenario.builder()
            .setId(newId("scenario"))
            .setDescription(description)
            .setTags(ImmutableSet.copyOf(tags))
            .setCreatedAt(clock.instant())
            .build();

    writeLock.lock();
    try {
      requireSubject(parentId, "Parent");
      storeNode(
          scenario.id(),
          NodeType.SCENARIO,
          scenario.description(),
          () -> graph.putScenario(scenario),
          () -> graph.addRelationship(subIdeaOf(scenario.id(), parentId)));
    } finally {
      writeLock.unlock();
    }
    logger.atInfo().log("Added scenario %s under %s", scenario.id(), parentId);
    return scenario.id();
  }

  @Override
  public String addContext(String market, String timeframe, String description) {
    requireText(market, "Context market");
    requireText(timeframe, "Context timeframe");
    Context context = Context.create(newId("context"), market, timeframe, nullToEmpty(description));

    writeLock.lock();
    try {
      storeNode(
          context.id(), NodeType.CONTEXT, context.embeddingText(), () -> graph.putContext(context));
    } finally {
      writeLock.unlock();
    }
    logger.atInfo().log("Added context %s: %s %s", context.id(), market, timeframe);
    return context.id();
  }

  @Override
  public String addBacktest(
      String subjectId,
      String contextId,
      Map<String, Double> metrics,
      String notes,
      Optional<String> scenarioId) {
    ImmutableMap<String, Double> validMetrics = validateMetrics(metrics);
    writeLock.lock();
    try {
      requireSubject(subjectId, "Subject");
      requireContext(contextId);
      scenarioId.ifPresent(this::requireScenario);
      return writeBacktest(
          subjectId,
          contextId,
          validMetrics,
          notes,
          scenarioId,
          ImmutableList.of(subjectId),
          /* backpropagated= */ false);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public String recordSimulation(
      String scenarioId, String contextId, Map<String, Double> metrics, String notes) {
    ImmutableMap<String, Double> validMetrics = validateMetrics(metrics);
    writeLock.lock();
    try {
      requireScenario(scenarioId);
      requireContext(contextId);
      ImmutableList<String> credited =
          ImmutableList.<String>builder()
              .add(scenarioId)
              .addAll(ancestorIds(scenarioId))
              .build();
      return writeBacktest(
          scenarioId,
          contextId,
          validMetrics,
          notes,
          Optional.of(scenarioId),
          credited,
          /* backpropagated= */ true);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public ImmutableList<SimilarityMatch> findSimilar(String text, NodeType nodeType, int topK) {
    return similar(text, nodeType, Optional.empty(), topK);
  }

  @Override
  public ImmutableList<SimilarityMatch> findSimilar(
      String text, NodeType nodeType, String contextId, int topK) {
    return similar(text, nodeType, Optional.of(contextId), topK);
  }

  @Override
  public ImmutableList<MetricRanking> bestByMetric(String metricName, int topK) {
    requireText(metricName, "Metric name");
    requirePositive(topK);
    List<MetricRanking> rankings = new ArrayList<>();
    for (NodeType type : ImmutableList.of(NodeType.IDEA, NodeType.SCENARIO)) {
      for (String id : call(() -> graph.nodeIds(type))) {
        ImmutableList<Backtest> backtests = directBacktests(id);
        if (backtests.isEmpty()) {
          continue;
        }
        double sum = 0.0;
        for (Backtest backtest : backtests) {
          sum += backtest.metrics().getOrDefault(metricName, 0.0);
        }
        rankings.add(MetricRanking.create(id, sum / backtests.size()));
      }
    }
    return rankings.stream().sorted(BY_VALUE).limit(topK).collect(toImmutableList());
  }

  @Override
  public GraphSnapshot getSubgraph(String rootId, int depth) {
    if (depth < 0) {
      throw new ValidationException("Subgraph depth cannot be negative: " + depth);
    }
    if (call(() -> graph.typeOf(rootId)).isEmpty()) {
      throw new NotFoundException("Node", rootId);
    }

    Map<String, Integer> depths = new LinkedHashMap<>();
    Set<Relationship> relationships = new LinkedHashSet<>();
    Queue<String> frontier = new ArrayDeque<>();
    depths.put(rootId, 0);
    frontier.add(rootId);
    while (!frontier.isEmpty()) {
      String id = frontier.poll();
      int hops = depths.get(id);
      if (hops == depth) {
        continue;
      }
      ImmutableList<Relationship> edges =
          ImmutableList.sortedCopyOf(Relationship.ORDERING, call(() -> graph.relationshipsOf(id)));
      for (Relationship relationship : edges) {
        relationships.add(relationship);
        String neighbour = relationship.otherEnd(id);
        if (!depths.containsKey(neighbour)) {
          depths.put(neighbour, hops + 1);
          frontier.add(neighbour);
        }
      }
    }

    ImmutableList<SnapshotNode> nodes =
        depths.entrySet().stream()
            .map(entry -> snapshotNode(entry.getKey(), entry.getValue()))
            .flatMap(Optional::stream)
            .collect(toImmutableList());
    return GraphSnapshot.create(
        rootId, nodes, ImmutableList.sortedCopyOf(Relationship.ORDERING, relationships));
  }

  @Override
  public Optional<Idea> getIdea(String id) {
    return call(() -> graph.getIdea(id));
  }

  @Override
  public Optional<Scenario> getScenario(String id) {
    return call(() -> graph.getScenario(id));
  }

  @Override
  public Optional<Context> getContext(String id) {
    return call(() -> graph.getContext(id));
  }

  @Override
  public Optional<Backtest> getBacktest(String id) {
    return call(() -> graph.getBacktest(id));
  }

  @Override
  public Optional<Subject> getSubject(String id) {
    return call(() -> graph.getSubject(id));
  }

  @Override
  public ImmutableList<Idea> listIdeas() {
    return call(() -> graph.nodeIds(NodeType.IDEA)).stream()
        .map(this::getIdea)
        .flatMap(Optional::stream)
        .collect(toImmutableList());
  }

  @Override
  public ImmutableList<Scenario> childrenOf(String parentId) {
    requireSubject(parentId, "Parent");
    return call(() -> graph.incoming(parentId, RelationshipType.SUBIDEA_OF)).stream()
        .map(Relationship::sourceId)
        .sorted()
        .map(this::getScenario)
        .flatMap(Optional::stream)
        .collect(toImmutableList());
  }

  @Override
  public Optional<Subject> parentOf(String scenarioId) {
    requireScenario(scenarioId);
    return parentId(scenarioId).flatMap(this::getSubject);
  }

  @Override
  public ImmutableList<Subject> ancestorsOf(String nodeId) {
    requireSubject(nodeId, "Node");
    return ancestorIds(nodeId).stream()
        .map(this::getSubject)
        .flatMap(Optional::stream)
        .collect(toImmutableList());
  }

  @Override
  public ImmutableList<Backtest> backtestsFor(String subjectId, Optional<String> contextId) {
    requireSubject(subjectId, "Subject");
    return directBacktests(subjectId).stream()
        .filter(backtest -> contextId.map(id -> id.equals(contextOf(backtest.id()))).orElse(true))
        .collect(toImmutableList());
  }

  @Override
  public ImmutableList<Backtest> backtestsApplyingTo(String scenarioId) {
    requireScenario(scenarioId);
    return call(() -> graph.incoming(scenarioId, RelationshipType.APPLIES_TO)).stream()
        .map(relationship -> getBacktest(relationship.sourceId()))
        .flatMap(Optional::stream)
        .sorted(BY_DATE)
        .collect(toImmutableList());
  }

  @Override
  public Optional<Context> findContext(String market, String timeframe) {
    return call(() -> graph.nodeIds(NodeType.CONTEXT)).stream()
        .map(this::getContext)
        .flatMap(Optional::stream)
        .filter(context -> context.market().equals(market))
        .filter(context -> context.timeframe().equals(timeframe))
        .findFirst();
  }

  @Override
  public SubjectPerformance performanceOf(String subjectId) {
    Subject subject = requireSubject(subjectId, "Subject");
    ImmutableList<Backtest> backtests = directBacktests(subjectId);
    Map<String, List<Double>> values = new TreeMap<>();
    for (Backtest backtest : backtests) {
      backtest
          .metrics()
          .forEach(
              (metric, value) ->
                  values.computeIfAbsent(metric, unused -> new ArrayList<>()).add(value));
    }

    ImmutableMap.Builder<String, MetricSummary> summaries = ImmutableMap.builder();
    values.forEach((metric, samples) -> summaries.put(metric, summarize(metric, samples)));
    return SubjectPerformance.create(
        subjectId,
        backtests.size(),
        subject.testCount(),
        subject.meanScore(),
        summaries.buildOrThrow());
  }

  @Override
  public ImmutableList<Recommendation> recommend(
      String text, Optional<String> contextId, int topK) {
    requirePositive(topK);
    List<Recommendation> tested = new ArrayList<>();
    List<Recommendation> untested = new ArrayList<>();
    for (NodeType type : ImmutableList.of(NodeType.IDEA, NodeType.SCENARIO)) {
      for (SimilarityMatch match : similar(text, type, contextId, 2 * topK)) {
        Optional<Subject> subject = getSubject(match.id());
        if (subject.isEmpty()) {
          continue;
        }
        Recommendation recommendation = toRecommendation(subject.get(), match.similarity());
        (recommendation.isTested() ? tested : untested).add(recommendation);
      }
    }
    tested.sort(BY_MEAN_SCORE);
    untested.sort(BY_SIMILARITY);
    return ImmutableList.<Recommendation>builder()
        .addAll(tested)
        .addAll(untested)
        .build()
        .stream()
        .limit(topK)
        .collect(toImmutableList());
  }

  @Override
  public void reparentScenario(String scenarioId, String newParentId) {
    writeLock.lock();
    try {
      requireScenario(scenarioId);
      requireSubject(newParentId, "Parent");
      if (newParentId.equals(scenarioId) || ancestorIds(newParentId).contains(scenarioId)) {
        throw new CycleException(scenarioId, newParentId);
      }
      Optional<String> oldParentId = parentId(scenarioId);
      if (oldParentId.equals(Optional.of(newParentId))) {
        return;
      }

      oldParentId.ifPresent(id -> run(() -> graph.removeRelationship(subIdeaOf(scenarioId, id))));
      try {
        run(() -> graph.addRelationship(subIdeaOf(scenarioId, newParentId)));
      } catch (RuntimeException e) {
        oldParentId.ifPresent(
            id ->
                compensate(
                    e, scenarioId, () -> graph.addRelationship(subIdeaOf(scenarioId, id))));
        throw e;
      }
      logger.atInfo().log(
          "Moved scenario %s from %s to %s", scenarioId, oldParentId.orElse("none"), newParentId);
      rebuildStatistics();
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public void discardScenario(String scenarioId) {
    writeLock.lock();
    try {
      requireScenario(scenarioId);
      if (!call(() -> graph.incoming(scenarioId, RelationshipType.SUBIDEA_OF)).isEmpty()) {
        throw new ValidationException("Scenario has children: " + scenarioId);
      }
      if (!call(() -> graph.outgoing(scenarioId, RelationshipType.TESTED_IN)).isEmpty()
          || !call(() -> graph.incoming(scenarioId, RelationshipType.APPLIES_TO)).isEmpty()) {
        throw new ValidationException("Scenario has backtests: " + scenarioId);
      }

      run(() -> graph.removeNode(scenarioId));
      try {
        run(() -> vectors.remove(scenarioId));
      } catch (RuntimeException e) {
        orphanedIds.add(scenarioId);
        logger.atSevere().withCause(e).log(
            "Vector of discarded scenario %s could not be removed", scenarioId);
        throw e;
      }
    } finally {
      writeLock.unlock();
    }
    logger.atInfo().log("Discarded scenario %s", scenarioId);
  }

  @Override
  public int rebuildStatistics() {
    writeLock.lock();
    try {
      Map<String, Long> counts = new HashMap<>();
      Map<String, Double> totals = new HashMap<>();
      for (String backtestId : call(() -> graph.nodeIds(NodeType.BACKTEST))) {
        Optional<Backtest> backtest = getBacktest(backtestId);
        Optional<String> subjectId =
            call(() -> graph.incoming(backtestId, RelationshipType.TESTED_IN)).stream()
                .map(Relationship::sourceId)
                .findFirst();
        if (backtest.isEmpty() || subjectId.isEmpty()) {
          logger.atWarning().log("Backtest %s has no subject and earns no credit", backtestId);
          continue;
        }

        double score = scoreFunction.score(backtest.get().metrics());
        List<String> credited = new ArrayList<>();
        credited.add(subjectId.get());
        if (backtest.get().backpropagated()) {
          credited.addAll(ancestorIds(subjectId.get()));
        }
        for (String id : credited) {
          counts.merge(id, 1L, Long::sum);
          totals.merge(id, score, Double::sum);
        }
      }

      int changed = 0;
      for (NodeType type : ImmutableList.of(NodeType.IDEA, NodeType.SCENARIO)) {
        for (String id : call(() -> graph.nodeIds(type))) {
          Optional<Subject> subject = getSubject(id);
          long count = counts.getOrDefault(id, 0L);
          double total = totals.getOrDefault(id, 0.0);
          if (subject.isEmpty()
              || (subject.get().testCount() == count
                  && Math.abs(subject.get().totalScore() - total) < SCORE_TOLERANCE)) {
            continue;
          }
          run(() -> graph.updateStatistics(id, count, total));
          changed++;
        }
      }
      logger.atInfo().log("Rebuilt statistics; %d subjects changed", changed);
      return changed;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public int reconcileIndex() {
    writeLock.lock();
    try {
      int repaired = 0;
      Set<String> repairedIds = new HashSet<>();
      ImmutableSet<String> flagged = ImmutableSet.copyOf(orphanedIds);
      boolean backtestRepaired = false;
      for (String id : flagged) {
        if (call(() -> graph.typeOf(id)).equals(Optional.of(NodeType.BACKTEST))) {
          run(() -> graph.removeNode(id));
          logger.atWarning().log("Removed backtest %s left behind by a failed rollback", id);
          repairedIds.add(id);
          backtestRepaired = true;
          repaired++;
        }
      }
      if (backtestRepaired) {
        repaired += rebuildStatistics();
      }

      ImmutableSet<String> indexed = call(vectors::ids);
      for (NodeType type : ImmutableList.of(NodeType.IDEA, NodeType.SCENARIO, NodeType.CONTEXT)) {
        for (String id : call(() -> graph.nodeIds(type))) {
          if (indexed.contains(id)) {
            continue;
          }
          double[] vector = embeddings.embed(embeddingText(id, type));
          run(() -> vectors.upsert(id, vector, type));
          if (type.isSubject()) {
            for (Backtest backtest : directBacktests(id)) {
              String contextId = contextOf(backtest.id());
              if (contextId != null) {
                run(() -> vectors.tagContext(id, contextId));
              }
            }
          }
          logger.atWarning().log("Re-indexed %s %s", type, id);
          repairedIds.add(id);
          repaired++;
        }
      }
      for (String id : indexed) {
        if (call(() -> graph.typeOf(id)).isEmpty()) {
          run(() -> vectors.remove(id));
          logger.atWarning().log("Dropped vector %s with no graph node", id);
          repairedIds.add(id);
          repaired++;
        }
      }
      for (String id : flagged) {
        boolean inGraph = call(() -> graph.typeOf(id)).isPresent();
        if (repairedIds.contains(id) || inGraph == indexed.contains(id)) {
          orphanedIds.remove(id);
        } else {
          logger.atSevere().log("%s is still inconsistent after reconciliation", id);
        }
      }
      return repaired;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public ImmutableSet<String> orphanedIds() {
    return ImmutableSet.copyOf(orphanedIds);
  }

  /** Applies the graph writes for a new node, then indexes it. Undoes the node on any failure. */
  private void storeNode(String id, NodeType type, String embeddingText, Runnable... graphWrites) {
    try {
      for (Runnable write : graphWrites) {
        run(write);
      }
      double[] vector = embeddings.embed(embeddingText);
      run(() -> vectors.upsert(id, vector, type));
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Failed to store %s %s; rolling back", type, id);
      compensate(e, id, () -> graph.removeNode(id));
      throw e;
    }
  }

  private String writeBacktest(
      String subjectId,
      String contextId,
      ImmutableMap<String, Double> metrics,
      String notes,
      Optional<String> appliesTo,
      ImmutableList<String> credited,
      boolean backpropagated) {
    double score = scoreFunction.score(metrics);
    Backtest backtest =
        Backtest.create(newId("bt"), clock.instant(), metrics, nullToEmpty(notes), backpropagated);
    Map<String, Subject> previous = new LinkedHashMap<>();
    try {
      run(() -> graph.putBacktest(backtest));
      link(RelationshipType.TESTED_IN, subjectId, backtest.id());
      link(RelationshipType.EXECUTED_IN, backtest.id(), contextId);
      appliesTo.ifPresent(
          scenarioId -> link(RelationshipType.APPLIES_TO, backtest.id(), scenarioId));
      for (String id : credited) {
        Subject current = requireSubject(id, "Subject");
        previous.put(id, current);
        long testCount = current.testCount() + 1;
        double totalScore = current.totalScore() + score;
        run(() -> graph.updateStatistics(id, testCount, totalScore));
      }
      run(() -> vectors.tagContext(subjectId, contextId));
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log(
          "Failed to record backtest of %s; rolling back", subjectId);
      compensate(
          e,
          backtest.id(),
          () -> {
            previous.values().forEach(
                subject ->
                    graph.updateStatistics(
                        subject.id(), subject.testCount(), subject.totalScore()));
            graph.removeNode(backtest.id());
          });
      throw e;
    }
    logger.atInfo().log(
        "Recorded backtest %s of %s in %s with score %.4f credited to %d subjects",
        backtest.id(), subjectId, contextId, score, credited.size());
    return backtest.id();
  }

  private void link(RelationshipType type, String sourceId, String targetId) {
    run(() -> graph.addRelationship(Relationship.create(type, sourceId, targetId)));
  }

  /** Runs an undo step; if it fails the id is flagged for {@link #reconcileIndex()}. */
  private void compensate(RuntimeException failure, String id, Runnable undo) {
    try {
      run(undo);
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
      orphanedIds.add(id);
      logger.atSevere().withCause(e).log("Rollback of %s failed; flagged as orphan", id);
    }
  }

  private ImmutableList<SimilarityMatch> similar(
      String text, NodeType nodeType, Optional<String> contextId, int topK) {
    requireText(text, "Query text");
    requirePositive(topK);
    double[] query = embeddings.embed(text);
    return call(() -> vectors.query(query, nodeType, contextId, topK));
  }

  /** Backtests linked to the subject by TESTED_IN, oldest first. */
  private ImmutableList<Backtest> directBacktests(String subjectId) {
    return call(() -> graph.outgoing(subjectId, RelationshipType.TESTED_IN)).stream()
        .map(relationship -> getBacktest(relationship.targetId()))
        .flatMap(Optional::stream)
        .sorted(BY_DATE)
        .collect(toImmutableList());
  }

  private String contextOf(String backtestId) {
    return call(() -> graph.outgoing(backtestId, RelationshipType.EXECUTED_IN)).stream()
        .map(Relationship::targetId)
        .findFirst()
        .orElse(null);
  }

  private Optional<String> parentId(String scenarioId) {
    return call(() -> graph.outgoing(scenarioId, RelationshipType.SUBIDEA_OF)).stream()
        .map(Relationship::targetId)
        .findFirst();
  }

  /** SUBIDEA_OF ancestors, nearest first. */
  private ImmutableList<String> ancestorIds(String nodeId) {
    ImmutableList.Builder<String> ancestors = ImmutableList.builder();
    Set<String> seen = new LinkedHashSet<>();
    seen.add(nodeId);
    Optional<String> current = parentId(nodeId);
    while (current.isPresent() && seen.add(current.get())) {
      ancestors.add(current.get());
      current = parentId(current.get());
    }
    return ancestors.build();
  }

  private Optional<SnapshotNode> snapshotNode(String id, int depth) {
    return call(() -> graph.typeOf(id))
        .map(type -> SnapshotNode.create(id, type, embeddingText(id, type), depth));
  }

  private String embeddingText(String id, NodeType type) {
    switch (type) {
      case IDEA:
      case SCENARIO:
        return getSubject(id).map(Subject::description).orElse(id);
      case CONTEXT:
        return getContext(id).map(Context::embeddingText).orElse(id);
      default:
        return getBacktest(id).map(backtest -> "Backtest " + backtest.date()).orElse(id);
    }
  }

  private Recommendation toRecommendation(Subject subject, double similarity) {
    return Recommendation.create(
        subject.id(),
        subject.type(),
        subject.description(),
        similarity,
        subject.testCount(),
        subject.meanScore());
  }

  private Subject requireSubject(String id, String kind) {
    checkNotNull(id, "%s id cannot be null", kind);
    return getSubject(id).orElseThrow(() -> new NotFoundException(kind, id));
  }

  private Scenario requireScenario(String id) {
    checkNotNull(id, "Scenario id cannot be null");
    return getScenario(id).orElseThrow(() -> new NotFoundException("Scenario", id));
  }

  private Context requireContext(String id) {
    checkNotNull(id, "Context id cannot be null");
    return getContext(id).orElseThrow(() -> new NotFoundException("Context", id));
  }

  private <T> T call(Supplier<T> storeCall) {
    return Retry.decorateSupplier(storeRetry, storeCall).get();
  }

  private void run(Runnable storeCall) {
    Retry.decorateRunnable(storeRetry, storeCall).run();
  }

  private static ImmutableMap<String, Double> validateMetrics(Map<String, Double> metrics) {
    if (metrics == null) {
      throw new ValidationException("Metrics cannot be null");
    }
    for (Map.Entry<String, Double> metric : metrics.entrySet()) {
      requireText(metric.getKey(), "Metric name");
      if (metric.getValue() == null || !Double.isFinite(metric.getValue())) {
        throw new ValidationException(
            String.format(
                "Metric %s is not a finite number: %s", metric.getKey(), metric.getValue()));
      }
    }
    return ImmutableMap.copyOf(metrics);
  }

  private static MetricSummary summarize(String metric, List<Double> samples) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double sum = 0.0;
    for (double sample : samples) {
      min = Math.min(min, sample);
      max = Math.max(max, sample);
      sum += sample;
    }
    return MetricSummary.create(metric, samples.size(), min, max, sum / samples.size());
  }

  private static Relationship subIdeaOf(String scenarioId, String parentId) {
    return Relationship.create(RelationshipType.SUBIDEA_OF, scenarioId, parentId);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.trim().isEmpty()) {
      throw new ValidationException(name + " cannot be blank");
    }
  }

  private static void requirePositive(int topK) {
    if (topK < 1) {
      throw new ValidationException("topK must be at least 1: " + topK);
    }
  }

  private static String newId(String prefix) {
    return prefix + "-" + UUID.randomUUID();
  }
}
