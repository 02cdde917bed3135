package com.verlumen.ideasearch.scoring;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

@AutoValue
public abstract class ScoringModule extends AbstractModule {
  public static ScoringModule create() {
    return create(WeightedScoreFunction.DEFAULT_WEIGHTS);
  }

  public static ScoringModule create(ImmutableMap<String, Double> weights) {
    return new AutoValue_ScoringModule(weights);
  }

  abstract ImmutableMap<String, Double> weights();

  @Provides
  @Singleton
  ScoreFunction provideScoreFunction() {
    return WeightedScoreFunction.create(weights());
  }
}
