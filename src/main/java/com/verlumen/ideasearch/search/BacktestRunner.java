package com.verlumen.ideasearch.search;

import com.google.common.collect.ImmutableMap;
import com.verlumen.ideasearch.errors.SimulationFailureException;
import com.verlumen.ideasearch.graph.Context;

/** Runs a strategy against historical data and reports its performance metrics. */
public interface BacktestRunner {
  /**
   * Returns named metrics such as {@code Sharpe}, {@code CAGR} and {@code MaxDrawdown}.
   *
   * @throws SimulationFailureException if the simulation crashed, timed out or was interrupted
   */
  ImmutableMap<String, Double> run(StrategySpec strategy, Context context)
      throws SimulationFailureException;
}
