package com.verlumen.ideasearch.memory;

import com.google.auto.value.AutoValue;

/** Distribution of one metric over a set of backtests. */
@AutoValue
public abstract class MetricSummary {
  public static MetricSummary create(
      String metric, int count, double min, double max, double mean) {
    return new AutoValue_MetricSummary(metric, count, min, max, mean);
  }

  public abstract String metric();

  /** Number of backtests that reported the metric. */
  public abstract int count();

  public abstract double min();

  public abstract double max();

  public abstract double mean();
}
