package com.verlumen.ideasearch.bandit;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

@AutoValue
public abstract class BanditModule extends AbstractModule {
  public static BanditModule create() {
    return create(UcbSelector.DEFAULT_EXPLORATION_CONSTANT);
  }

  public static BanditModule create(double explorationConstant) {
    return new AutoValue_BanditModule(explorationConstant);
  }

  abstract double explorationConstant();

  @Provides
  @Singleton
  BanditSelector provideBanditSelector() {
    return UcbSelector.create(explorationConstant());
  }
}
