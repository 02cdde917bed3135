package com.verlumen.ideasearch.graph;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;

/** A concrete variation of an idea or of another scenario, linked to its parent by SUBIDEA_OF. */
@AutoValue
public abstract class Scenario implements Subject {
  public static Builder builder() {
    return new AutoValue_Scenario.Builder()
        .setTags(ImmutableSet.of())
        .setTestCount(0)
        .setTotalScore(0.0);
  }

  @Override
  public abstract String id();

  @Override
  public abstract String description();

  @Override
  public abstract ImmutableSet<String> tags();

  @Override
  public abstract Instant createdAt();

  @Override
  public abstract long testCount();

  @Override
  public abstract double totalScore();

  public abstract Builder toBuilder();

  @Override
  public final NodeType type() {
    return NodeType.SCENARIO;
  }

  @Override
  public Scenario withStatistics(long testCount, double totalScore) {
    return toBuilder().setTestCount(testCount).setTotalScore(totalScore).build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(String id);

    public abstract Builder setDescription(String description);

    public abstract Builder setTags(ImmutableSet<String> tags);

    public abstract Builder setCreatedAt(Instant createdAt);

    public abstract Builder setTestCount(long testCount);

    public abstract Builder setTotalScore(double totalScore);

    public abstract Scenario build();
  }
}
