package com.verlumen.ideasearch.graph;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;

/**
 * Immutable record of one simulation outcome. Corrections are made by writing a new backtest.
 *
 * <p>{@code backpropagated} is set when the result was also credited to every SUBIDEA_OF ancestor
 * of the tested subject, as tree search does.
 */
@AutoValue
public abstract class Backtest {
  public static Backtest create(
      String id,
      Instant date,
      ImmutableMap<String, Double> metrics,
      String notes,
      boolean backpropagated) {
    return new AutoValue_Backtest(id, date, metrics, notes, backpropagated);
  }

  public abstract String id();

  public abstract Instant date();

  public abstract ImmutableMap<String, Double> metrics();

  public abstract String notes();

  public abstract boolean backpropagated();
}
