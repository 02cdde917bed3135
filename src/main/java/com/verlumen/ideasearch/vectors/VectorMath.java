package com.verlumen.ideasearch.vectors;

import static com.google.common.base.Preconditions.checkArgument;

final class VectorMath {
  /** Scales the vector to unit length in place. A zero vector is returned unchanged. */
  static double[] normalize(double[] vector) {
    double norm = Math.sqrt(dot(vector, vector));
    if (norm == 0.0) {
      return vector;
    }
    for (int i = 0; i < vector.length; i++) {
      vector[i] /= norm;
    }
    return vector;
  }

  /** Cosine similarity; 0 when either vector is all zeros. */
  static double cosine(double[] a, double[] b) {
    double denominator = Math.sqrt(dot(a, a)) * Math.sqrt(dot(b, b));
    return denominator == 0.0 ? 0.0 : dot(a, b) / denominator;
  }

  private static double dot(double[] a, double[] b) {
    checkArgument(a.length == b.length, "Dimension mismatch: %s vs %s", a.length, b.length);
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }

  private VectorMath() {}
}
