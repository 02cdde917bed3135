package com.verlumen.ideasearch.memory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/**
 * Performance report for an idea or scenario, built from the backtests it was tested in directly.
 * The counters are those used by the bandit and may include credit from descendants.
 */
@AutoValue
public abstract class SubjectPerformance {
  public static SubjectPerformance create(
      String subjectId,
      int backtestCount,
      long testCount,
      double meanScore,
      ImmutableMap<String, MetricSummary> metrics) {
    return new AutoValue_SubjectPerformance(
        subjectId, backtestCount, testCount, meanScore, metrics);
  }

  public abstract String subjectId();

  /** Backtests linked to the subject by TESTED_IN. */
  public abstract int backtestCount();

  public abstract long testCount();

  public abstract double meanScore();

  /** Summaries keyed by metric name, in name order. */
  public abstract ImmutableMap<String, MetricSummary> metrics();
}
