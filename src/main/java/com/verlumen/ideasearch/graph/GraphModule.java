package com.verlumen.ideasearch.graph;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

public final class GraphModule extends AbstractModule {
  public static GraphModule create() {
    return new GraphModule();
  }

  @Override
  protected void configure() {
    bind(GraphStore.class).to(InMemoryGraphStore.class).in(Singleton.class);
  }

  private GraphModule() {}
}
