package com.verlumen.ideasearch.scoring;

import java.util.Map;

/** Reduces the metrics of one backtest to the scalar reward used by the bandit. */
public interface ScoreFunction {
  double score(Map<String, Double> metrics);
}
