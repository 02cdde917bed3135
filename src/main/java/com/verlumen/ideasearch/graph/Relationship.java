package com.verlumen.ideasearch.graph;

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/** A typed, directed edge between two nodes. */
@AutoValue
public abstract class Relationship {
  public static final Comparator<Relationship> ORDERING =
      Comparator.comparing(Relationship::type)
          .thenComparing(Relationship::sourceId)
          .thenComparing(Relationship::targetId);

  public static Relationship create(RelationshipType type, String sourceId, String targetId) {
    return new AutoValue_Relationship(type, sourceId, targetId);
  }

  public abstract RelationshipType type();

  public abstract String sourceId();

  public abstract String targetId();

  /** Returns the endpoint that is not {@code nodeId}. */
  public String otherEnd(String nodeId) {
    return sourceId().equals(nodeId) ? targetId() : sourceId();
  }
}
