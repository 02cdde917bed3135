package com.verlumen.ideasearch.vectors;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

@AutoValue
public abstract class VectorsModule extends AbstractModule {
  public static VectorsModule create(int embeddingDimension) {
    return new AutoValue_VectorsModule(embeddingDimension);
  }

  abstract int embeddingDimension();

  @Override
  protected void configure() {
    bind(VectorIndex.class).to(InMemoryVectorIndex.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  EmbeddingProvider provideEmbeddingProvider() {
    return HashingEmbeddingProvider.create(embeddingDimension());
  }
}
