package com.verlumen.ideasearch.memory;

import com.google.auto.value.AutoValue;

/** An idea or scenario with its average value of one metric across its backtests. */
@AutoValue
public abstract class MetricRanking {
  public static MetricRanking create(String subjectId, double value) {
    return new AutoValue_MetricRanking(subjectId, value);
  }

  public abstract String subjectId();

  public abstract double value();
}
