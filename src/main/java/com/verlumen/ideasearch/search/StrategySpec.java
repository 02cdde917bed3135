package com.verlumen.ideasearch.search;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** What a backtest runner needs to know about the idea or scenario it simulates. */
@AutoValue
public abstract class StrategySpec {
  public static StrategySpec create(
      String subjectId,
      String description,
      ImmutableSet<String> tags,
      ImmutableList<String> lineage) {
    return new AutoValue_StrategySpec(subjectId, description, tags, lineage);
  }

  public abstract String subjectId();

  public abstract String description();

  public abstract ImmutableSet<String> tags();

  /** Descriptions of the SUBIDEA_OF ancestors, nearest first, ending at the root idea. */
  public abstract ImmutableList<String> lineage();
}
