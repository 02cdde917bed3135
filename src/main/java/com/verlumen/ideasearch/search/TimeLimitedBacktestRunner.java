package com.verlumen.ideasearch.search;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.verlumen.ideasearch.errors.SimulationFailureException;
import com.verlumen.ideasearch.graph.Context;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs each simulation of a delegate runner on a worker thread and gives up once the time limit
 * passes. Timeouts, crashes and interruptions all surface as {@link SimulationFailureException}.
 */
public final class TimeLimitedBacktestRunner implements BacktestRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static TimeLimitedBacktestRunner create(BacktestRunner delegate, Duration timeLimit) {
    checkArgument(
        !timeLimit.isNegative() && !timeLimit.isZero(),
        "Time limit must be positive: %s",
        timeLimit);
    ExecutorService executor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("simulation-%d").build());
    return new TimeLimitedBacktestRunner(delegate, timeLimit, executor);
  }

  private final BacktestRunner delegate;
  private final Duration timeLimit;
  private final ExecutorService executor;

  private TimeLimitedBacktestRunner(
      BacktestRunner delegate, Duration timeLimit, ExecutorService executor) {
    this.delegate = delegate;
    this.timeLimit = timeLimit;
    this.executor = executor;
  }

  @Override
  public ImmutableMap<String, Double> run(StrategySpec strategy, Context context)
      throws SimulationFailureException {
    Future<ImmutableMap<String, Double>> result;
    try {
      result = executor.submit(() -> delegate.run(strategy, context));
    } catch (RejectedExecutionException e) {
      throw new SimulationFailureException(
          "Runner is shut down; cannot simulate " + strategy.subjectId(), e, false);
    }
    try {
      return result.get(timeLimit.toMillis(), MILLISECONDS);
    } catch (TimeoutException e) {
      result.cancel(true);
      logger.atWarning().log(
          "Simulation of %s exceeded %s; cancelled", strategy.subjectId(), timeLimit);
      throw new SimulationFailureException(
          "Simulation of " + strategy.subjectId() + " timed out after " + timeLimit,
          e,
          /* retryable= */ true);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof SimulationFailureException) {
        throw (SimulationFailureException) e.getCause();
      }
      throw new SimulationFailureException(
          "Simulation of " + strategy.subjectId() + " crashed", e.getCause(), false);
    } catch (InterruptedException e) {
      result.cancel(true);
      Thread.currentThread().interrupt();
      throw new SimulationFailureException(
          "Interrupted while simulating " + strategy.subjectId(), e, false);
    }
  }

  /**
   * Stops the worker threads, interrupting simulations still in flight. Later calls to {@link #run}
   * fail with a non-retryable {@link SimulationFailureException}.
   */
  public void shutdown() {
    executor.shutdownNow();
  }
}
