package com.verlumen.ideasearch.config;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.verlumen.ideasearch.bandit.BanditModule;
import com.verlumen.ideasearch.graph.GraphModule;
import com.verlumen.ideasearch.memory.MemoryModule;
import com.verlumen.ideasearch.scoring.ScoringModule;
import com.verlumen.ideasearch.search.BacktestRunner;
import com.verlumen.ideasearch.search.SearchModule;
import com.verlumen.ideasearch.vectors.VectorsModule;

/** Installs the complete engine around a simulation backend supplied by the caller. */
@AutoValue
public abstract class IdeaSearchModule extends AbstractModule {
  public static IdeaSearchModule create(
      IdeaSearchConfig config, BacktestRunner simulationBackend) {
    return new AutoValue_IdeaSearchModule(config, simulationBackend);
  }

  abstract IdeaSearchConfig config();

  abstract BacktestRunner simulationBackend();

  @Override
  protected void configure() {
    bind(IdeaSearchConfig.class).toInstance(config());
    install(GraphModule.create());
    install(VectorsModule.create(config().embeddingDimension()));
    install(ScoringModule.create(config().scoreWeights()));
    install(BanditModule.create(config().explorationConstant()));
    install(
        MemoryModule.create(config().storeMaxAttempts(), config().storeInitialBackoffMillis()));
    install(SearchModule.create(config().searchConfig(), simulationBackend()));
  }
}
