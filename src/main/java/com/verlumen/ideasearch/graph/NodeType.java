package com.verlumen.ideasearch.graph;

/** The four kinds of node held in the knowledge graph. */
public enum NodeType {
  IDEA,
  SCENARIO,
  CONTEXT,
  BACKTEST;

  /** Ideas and scenarios are the nodes that get tested and carry bandit statistics. */
  public boolean isSubject() {
    return this == IDEA || this == SCENARIO;
  }
}
