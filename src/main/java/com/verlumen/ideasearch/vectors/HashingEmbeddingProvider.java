package com.verlumen.ideasearch.vectors;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Embeds text by feature hashing its unigrams and bigrams into a fixed number of buckets and
 * normalizing the result to unit length. Signed hashing keeps bucket collisions from always
 * adding up.
 */
final class HashingEmbeddingProvider implements EmbeddingProvider {
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128(0x1dea5);
  private static final CharMatcher TOKEN_CHARS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('0', '9'));
  private static final Splitter TOKENIZER = Splitter.on(TOKEN_CHARS.negate()).omitEmptyStrings();
  private static final double UNIGRAM_WEIGHT = 1.0;
  private static final double BIGRAM_WEIGHT = 0.5;

  static HashingEmbeddingProvider create(int dimension) {
    checkArgument(dimension > 0, "Embedding dimension must be positive: %s", dimension);
    return new HashingEmbeddingProvider(dimension);
  }

  private final int dimension;

  private HashingEmbeddingProvider(int dimension) {
    this.dimension = dimension;
  }

  @Override
  public double[] embed(String text) {
    double[] vector = new double[dimension];
    ImmutableList<String> tokens = ImmutableList.copyOf(TOKENIZER.split(Ascii.toLowerCase(text)));
    for (int i = 0; i < tokens.size(); i++) {
      accumulate(vector, "u:" + tokens.get(i), UNIGRAM_WEIGHT);
      if (i + 1 < tokens.size()) {
        accumulate(vector, "b:" + tokens.get(i) + " " + tokens.get(i + 1), BIGRAM_WEIGHT);
      }
    }
    return VectorMath.normalize(vector);
  }

  @Override
  public int dimension() {
    return dimension;
  }

  private void accumulate(double[] vector, String feature, double weight) {
    long hash = HASH_FUNCTION.hashString(feature, UTF_8).asLong();
    int bucket = Math.floorMod(hash, dimension);
    double sign = (hash >>> 63) == 0 ? 1.0 : -1.0;
    vector[bucket] += sign * weight;
  }
}
