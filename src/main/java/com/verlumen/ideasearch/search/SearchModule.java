package com.verlumen.ideasearch.search;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.Random;

/**
 * Binds the tree search around an externally supplied simulation backend, which is wrapped in a
 * {@link TimeLimitedBacktestRunner}. The runner is an injector-wide singleton that owns the
 * simulation threads; whoever creates the injector calls {@link TimeLimitedBacktestRunner#shutdown}
 * on it when done.
 */
@AutoValue
public abstract class SearchModule extends AbstractModule {
  public static SearchModule create(SearchConfig config, BacktestRunner simulationBackend) {
    return new AutoValue_SearchModule(config, simulationBackend);
  }

  abstract SearchConfig config();

  abstract BacktestRunner simulationBackend();

  @Override
  protected void configure() {
    bind(SearchConfig.class).toInstance(config());
    bind(TreeSearch.class).to(MonteCarloTreeSearch.class).in(Singleton.class);
    bind(BacktestRunner.class).to(TimeLimitedBacktestRunner.class);
  }

  @Provides
  @Singleton
  TimeLimitedBacktestRunner provideTimeLimitedBacktestRunner() {
    return TimeLimitedBacktestRunner.create(simulationBackend(), config().simulationTimeout());
  }

  @Provides
  @Singleton
  ExpansionStrategy provideExpansionStrategy() {
    return RandomVariationStrategy.create(new Random());
  }
}
