package com.verlumen.ideasearch.graph;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.auto.value.AutoValue;

/** The market and timeframe under which a backtest was run. Reusable across many backtests. */
@AutoValue
public abstract class Context {
  public static Context create(String id, String market, String timeframe, String description) {
    return new AutoValue_Context(id, market, timeframe, description);
  }

  public abstract String id();

  public abstract String market();

  public abstract String timeframe();

  public abstract String description();

  /** Text embedded into the vector index for this context. */
  public String embeddingText() {
    return isNullOrEmpty(description().trim()) ? market() + " " + timeframe() : description();
  }
}
