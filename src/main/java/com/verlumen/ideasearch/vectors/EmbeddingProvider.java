package com.verlumen.ideasearch.vectors;

/**
 * Maps free text to a fixed-length vector. Implementations must return the same vector for the
 * same text within a process.
 */
public interface EmbeddingProvider {
  double[] embed(String text);

  int dimension();
}
