package com.verlumen.ideasearch.vectors;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HashingEmbeddingProviderTest {
  private final HashingEmbeddingProvider provider = HashingEmbeddingProvider.create(384);

  @Test
  public void embed_sameText_returnsSameVector() {
    assertThat(provider.embed("Mean reversion on SPY"))
        .isEqualTo(provider.embed("mean reversion on spy"));
  }

  @Test
  public void embed_returnsUnitVectorOfConfiguredDimension() {
    // Act
    double[] vector = provider.embed("breakout with volume confirmation");

    // Assert
    assertThat(vector).hasLength(384);
    double norm = 0.0;
    for (double value : vector) {
      norm += value * value;
    }
    assertThat(Math.sqrt(norm)).isWithin(1e-9).of(1.0);
  }

  @Test
  public void embed_textWithoutTokens_returnsZeroVector() {
    // Act
    double[] vector = provider.embed("  --  ");

    // Assert
    for (double value : vector) {
      assertThat(value).isEqualTo(0.0);
    }
  }

  @Test
  public void embed_sharedWords_scoreHigherThanUnrelatedText() {
    // Arrange
    double[] query = provider.embed("mean reversion on SPY");

    // Act
    double related = VectorMath.cosine(query, provider.embed("mean reversion on QQQ"));
    double unrelated = VectorMath.cosine(query, provider.embed("momentum breakout in crypto"));

    // Assert
    assertThat(related).isGreaterThan(0.5);
    assertThat(related).isGreaterThan(unrelated);
  }

  @Test
  public void create_nonPositiveDimension_throws() {
    assertThrows(IllegalArgumentException.class, () -> HashingEmbeddingProvider.create(0));
  }
}
