package com.verlumen.ideasearch.memory;

import com.google.auto.value.AutoValue;
import com.verlumen.ideasearch.graph.NodeType;

/** A previously stored idea or scenario suggested for a new piece of text. */
@AutoValue
public abstract class Recommendation {
  public static Recommendation create(
      String subjectId,
      NodeType type,
      String description,
      double similarity,
      long testCount,
      double meanScore) {
    return new AutoValue_Recommendation(
        subjectId, type, description, similarity, testCount, meanScore);
  }

  public abstract String subjectId();

  public abstract NodeType type();

  public abstract String description();

  public abstract double similarity();

  public abstract long testCount();

  public abstract double meanScore();

  public boolean isTested() {
    return testCount() > 0;
  }
}
