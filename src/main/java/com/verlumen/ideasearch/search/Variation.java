package com.verlumen.ideasearch.search;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

/** A proposed child scenario and the market conditions to test it under. */
@AutoValue
public abstract class Variation {
  public static Variation create(
      String description, ImmutableSet<String> tags, String market, String timeframe) {
    return new AutoValue_Variation(description, tags, market, timeframe);
  }

  public abstract String description();

  public abstract ImmutableSet<String> tags();

  public abstract String market();

  public abstract String timeframe();
}
