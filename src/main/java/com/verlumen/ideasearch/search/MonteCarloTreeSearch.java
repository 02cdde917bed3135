package com.verlumen.ideasearch.search;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.ideasearch.bandit.Arm;
import com.verlumen.ideasearch.bandit.BanditSelector;
import com.verlumen.ideasearch.errors.NotFoundException;
import com.verlumen.ideasearch.errors.SimulationFailureException;
import com.verlumen.ideasearch.errors.ValidationException;
import com.verlumen.ideasearch.graph.Context;
import com.verlumen.ideasearch.graph.Scenario;
import com.verlumen.ideasearch.graph.Subject;
import com.verlumen.ideasearch.memory.HybridMemory;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tree search over the SUBIDEA_OF hierarchy of one root idea. The tree is the stored graph itself:
 * each iteration adds one scenario and, if its simulation succeeds, one backtest whose score is
 * credited to the scenario and all of its ancestors. A failed iteration removes the scenario again.
 */
final class MonteCarloTreeSearch implements TreeSearch {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final HybridMemory memory;
  private final BanditSelector selector;
  private final ExpansionStrategy expansionStrategy;
  private final BacktestRunner backtestRunner;
  private final SearchConfig config;
  private final Set<String> activeRoots = ConcurrentHashMap.newKeySet();

  @Inject
  MonteCarloTreeSearch(
      HybridMemory memory,
      BanditSelector selector,
      ExpansionStrategy expansionStrategy,
      BacktestRunner backtestRunner,
      SearchConfig config) {
    this.memory = memory;
    this.selector = selector;
    this.expansionStrategy = expansionStrategy;
    this.backtestRunner = backtestRunner;
    this.config = config;
  }

  @Override
  public SearchResult search(String rootIdeaId, int iterations) {
    checkArgument(iterations >= 0, "Iterations cannot be negative: %s", iterations);
    if (memory.getIdea(rootIdeaId).isEmpty()) {
      throw new NotFoundException("Idea", rootIdeaId);
    }
    if (!activeRoots.add(rootIdeaId)) {
      throw new IllegalStateException("A search is already running for " + rootIdeaId);
    }

    try {
      logger.atInfo().log("Starting %d iterations from %s", iterations, rootIdeaId);
      int attempted = 0;
      int succeeded = 0;
      while (attempted < iterations) {
        if (Thread.currentThread().isInterrupted()) {
          logger.atWarning().log(
              "Search from %s interrupted after %d iterations", rootIdeaId, attempted);
          break;
        }
        attempted++;
        if (iterate(rootIdeaId)) {
          succeeded++;
        }
      }

      Optional<Arm> bestChild = selector.bestByMean(armsOf(memory.childrenOf(rootIdeaId)));
      logger.atInfo().log(
          "Search from %s finished: %d of %d iterations succeeded, best child %s",
          rootIdeaId, succeeded, attempted, bestChild.map(Arm::id).orElse("none"));
      return SearchResult.create(
          rootIdeaId, attempted, succeeded, attempted - succeeded, bestChild);
    } finally {
      activeRoots.remove(rootIdeaId);
    }
  }

  /** Returns whether a backtest was recorded. */
  private boolean iterate(String rootIdeaId) {
    Subject leaf = select(rootIdeaId);
    Optional<Variation> variation = proposeVariation(leaf);
    if (variation.isEmpty()) {
      logger.atWarning().log(
          "No new variation of %s after %d proposals", leaf.id(), config.maxExpansionAttempts());
      return false;
    }

    Context context = contextFor(variation.get());
    String scenarioId =
        memory.addScenario(variation.get().description(), leaf.id(), variation.get().tags());
    StrategySpec strategy = strategyFor(scenarioId, variation.get(), leaf);

    ImmutableMap<String, Double> metrics;
    try {
      metrics = backtestRunner.run(strategy, context);
    } catch (SimulationFailureException e) {
      logger.atWarning().withCause(e).log(
          "Simulation of %s failed (retryable: %s); discarding it", scenarioId, e.isRetryable());
      memory.discardScenario(scenarioId);
      return false;
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Simulation of %s crashed; discarding it", scenarioId);
      memory.discardScenario(scenarioId);
      return false;
    }

    try {
      memory.recordSimulation(scenarioId, context.id(), metrics, "Tree search from " + rootIdeaId);
      return true;
    } catch (ValidationException e) {
      logger.atWarning().withCause(e).log(
          "Simulation of %s returned unusable metrics %s; discarding it", scenarioId, metrics);
      memory.discardScenario(scenarioId);
      return false;
    } catch (RuntimeException e) {
      try {
        memory.discardScenario(scenarioId);
      } catch (RuntimeException discardFailure) {
        e.addSuppressed(discardFailure);
      }
      throw e;
    }
  }

  /** Descends from the root through fully expanded nodes, picking children by UCB. */
  private Subject select(String rootIdeaId) {
    Subject current =
        memory.getSubject(rootIdeaId).orElseThrow(() -> new NotFoundException("Idea", rootIdeaId));
    while (true) {
      ImmutableList<Scenario> children = memory.childrenOf(current.id());
      if (children.size() < config.branchingAllowance()) {
        return current;
      }
      String selectedId = selector.select(armsOf(children)).id();
      current =
          children.stream()
              .filter(child -> child.id().equals(selectedId))
              .findFirst()
              .orElseThrow(() -> new NotFoundException("Scenario", selectedId));
    }
  }

  private Optional<Variation> proposeVariation(Subject parent) {
    ImmutableSet<String> existing =
        memory.childrenOf(parent.id()).stream()
            .map(Scenario::description)
            .collect(toImmutableSet());
    for (int attempt = 0; attempt < config.maxExpansionAttempts(); attempt++) {
      Variation variation =
          expansionStrategy.proposeVariation(parent.description(), parent.tags());
      if (!existing.contains(variation.description())) {
        return Optional.of(variation);
      }
      logger.atFine().log("Duplicate variation of %s: %s", parent.id(), variation.description());
    }
    return Optional.empty();
  }

  private Context contextFor(Variation variation) {
    return memory
        .findContext(variation.market(), variation.timeframe())
        .or(
            () -> {
              String contextId = memory.addContext(variation.market(), variation.timeframe(), "");
              return memory.getContext(contextId);
            })
        .orElseThrow(
            () ->
                new NotFoundException(
                    "Context", variation.market() + " " + variation.timeframe()));
  }

  private StrategySpec strategyFor(String scenarioId, Variation variation, Subject parent) {
    ImmutableList<String> lineage =
        ImmutableList.<String>builder()
            .add(parent.description())
            .addAll(
                memory.ancestorsOf(parent.id()).stream()
                    .map(Subject::description)
                    .collect(toImmutableList()))
            .build();
    return StrategySpec.create(scenarioId, variation.description(), variation.tags(), lineage);
  }

  private static ImmutableList<Arm> armsOf(ImmutableList<Scenario> scenarios) {
    return scenarios.stream().map(Arm::fromSubject).collect(toImmutableList());
  }
}
