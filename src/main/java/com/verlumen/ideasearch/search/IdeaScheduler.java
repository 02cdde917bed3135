package com.verlumen.ideasearch.search;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.ideasearch.bandit.Arm;
import com.verlumen.ideasearch.bandit.BanditSelector;
import com.verlumen.ideasearch.errors.NotFoundException;
import com.verlumen.ideasearch.errors.SimulationFailureException;
import com.verlumen.ideasearch.graph.Context;
import com.verlumen.ideasearch.graph.Idea;
import com.verlumen.ideasearch.memory.HybridMemory;
import java.util.Optional;

/**
 * Decides which root idea to backtest next by treating every idea as an arm of one bandit, then
 * runs and records that backtest. Unlike {@link TreeSearch} no scenarios are created.
 */
public final class IdeaScheduler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final HybridMemory memory;
  private final BanditSelector selector;
  private final BacktestRunner backtestRunner;

  @Inject
  IdeaScheduler(HybridMemory memory, BanditSelector selector, BacktestRunner backtestRunner) {
    this.memory = memory;
    this.selector = selector;
    this.backtestRunner = backtestRunner;
  }

  /** The idea the bandit would test next, or empty when no idea is stored. */
  public Optional<Idea> nextIdea() {
    ImmutableList<Idea> ideas = memory.listIdeas();
    if (ideas.isEmpty()) {
      return Optional.empty();
    }
    String selectedId =
        selector.select(ideas.stream().map(Arm::fromSubject).collect(toImmutableList())).id();
    return ideas.stream().filter(idea -> idea.id().equals(selectedId)).findFirst();
  }

  /**
   * Backtests the next idea in the given context and returns the id of the recorded backtest.
   * Returns empty when there is nothing to test or the simulation failed.
   */
  public Optional<String> runNext(String contextId) {
    Context context =
        memory.getContext(contextId).orElseThrow(() -> new NotFoundException("Context", contextId));
    Optional<Idea> idea = nextIdea();
    if (idea.isEmpty()) {
      logger.atInfo().log("No ideas to schedule");
      return Optional.empty();
    }

    StrategySpec strategy =
        StrategySpec.create(
            idea.get().id(), idea.get().description(), idea.get().tags(), ImmutableList.of());
    ImmutableMap<String, Double> metrics;
    try {
      metrics = backtestRunner.run(strategy, context);
    } catch (SimulationFailureException e) {
      logger.atWarning().withCause(e).log("Backtest of idea %s failed", idea.get().id());
      return Optional.empty();
    }
    String backtestId =
        memory.addBacktest(
            idea.get().id(), context.id(), metrics, "Scheduled by UCB", Optional.empty());
    logger.atInfo().log("Backtested idea %s as %s", idea.get().id(), backtestId);
    return Optional.of(backtestId);
  }

  /** Runs {@code runs} scheduled backtests and returns how many were recorded. */
  public int runBatch(String contextId, int runs) {
    checkArgument(runs >= 0, "Runs cannot be negative: %s", runs);
    int recorded = 0;
    for (int i = 0; i < runs && !Thread.currentThread().isInterrupted(); i++) {
      if (runNext(contextId).isPresent()) {
        recorded++;
      }
    }
    return recorded;
  }
}
