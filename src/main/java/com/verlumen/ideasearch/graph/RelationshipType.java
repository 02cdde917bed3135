package com.verlumen.ideasearch.graph;

import com.google.common.collect.ImmutableSet;

/** Directed relationship types, each with the node types allowed at either end. */
public enum RelationshipType {
  TESTED_IN(
      ImmutableSet.of(NodeType.IDEA, NodeType.SCENARIO), ImmutableSet.of(NodeType.BACKTEST)),
  EXECUTED_IN(ImmutableSet.of(NodeType.BACKTEST), ImmutableSet.of(NodeType.CONTEXT)),
  APPLIES_TO(ImmutableSet.of(NodeType.BACKTEST), ImmutableSet.of(NodeType.SCENARIO)),
  SUBIDEA_OF(
      ImmutableSet.of(NodeType.SCENARIO), ImmutableSet.of(NodeType.IDEA, NodeType.SCENARIO));

  private final ImmutableSet<NodeType> sourceTypes;
  private final ImmutableSet<NodeType> targetTypes;

  RelationshipType(ImmutableSet<NodeType> sourceTypes, ImmutableSet<NodeType> targetTypes) {
    this.sourceTypes = sourceTypes;
    this.targetTypes = targetTypes;
  }

  public boolean accepts(NodeType source, NodeType target) {
    return sourceTypes.contains(source) && targetTypes.contains(target);
  }
}
