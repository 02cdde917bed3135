package com.verlumen.ideasearch.graph;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Read-only view of a neighbourhood of the graph, for external visualization. */
@AutoValue
public abstract class GraphSnapshot {
  public static GraphSnapshot create(
      String rootId, ImmutableList<SnapshotNode> nodes, ImmutableList<Relationship> relationships) {
    return new AutoValue_GraphSnapshot(rootId, nodes, relationships);
  }

  public abstract String rootId();

  /** Nodes in breadth-first order from the root. */
  public abstract ImmutableList<SnapshotNode> nodes();

  public abstract ImmutableList<Relationship> relationships();

  /** A node in the snapshot with a human readable label. */
  @AutoValue
  public abstract static class SnapshotNode {
    public static SnapshotNode create(String id, NodeType type, String label, int depth) {
      return new AutoValue_GraphSnapshot_SnapshotNode(id, type, label, depth);
    }

    public abstract String id();

    public abstract NodeType type();

    public abstract String label();

    /** Hops from the snapshot root. */
    public abstract int depth();
  }
}
