package com.verlumen.ideasearch.vectors;

import com.google.auto.value.AutoValue;

/** A node id together with its similarity to a query vector. */
@AutoValue
public abstract class SimilarityMatch {
  public static SimilarityMatch create(String id, double similarity) {
    return new AutoValue_SimilarityMatch(id, similarity);
  }

  public abstract String id();

  public abstract double similarity();
}
