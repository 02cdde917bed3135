package com.verlumen.ideasearch.search;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RandomVariationStrategyTest {
  private final RandomVariationStrategy strategy = RandomVariationStrategy.create(new Random(7));

  @Test
  public void proposeVariation_keepsParentDescriptionAndKnownContexts() {
    // Arrange
    ImmutableSet<String> parentTags =
        ImmutableSet.of("market:SPY", "timeframe:DAILY", "param:lookback=10", "equities");
    boolean sawContextChange = false;
    boolean sawParameterChange = false;

    for (int i = 0; i < 50; i++) {
      // Act
      Variation variation = strategy.proposeVariation("mean reversion", parentTags);

      // Assert
      assertThat(variation.description()).startsWith("mean reversion ");
      assertThat(variation.tags()).contains("equities");
      assertThat(variation.tags())
          .contains(RandomVariationStrategy.MARKET_TAG + variation.market());
      assertThat(variation.tags())
          .contains(RandomVariationStrategy.TIMEFRAME_TAG + variation.timeframe());
      assertThat(
              variation.tags().stream().filter(tag -> tag.startsWith("param:lookback=")).count())
          .isAtMost(1L);
      if (variation.description().contains(" on ")) {
        sawContextChange = true;
        assertThat(RandomVariationStrategy.MARKETS).contains(variation.market());
        assertThat(RandomVariationStrategy.TIMEFRAMES).contains(variation.timeframe());
      } else {
        sawParameterChange = true;
        assertThat(variation.market()).isEqualTo("SPY");
        assertThat(variation.timeframe()).isEqualTo("DAILY");
      }
    }
    assertThat(sawContextChange).isTrue();
    assertThat(sawParameterChange).isTrue();
  }

  @Test
  public void proposeVariation_untaggedParent_defaultsToBtcDaily() {
    for (int i = 0; i < 20; i++) {
      // Act
      Variation variation = strategy.proposeVariation("breakout", ImmutableSet.of());

      // Assert
      if (variation.description().contains(" with ")) {
        assertThat(variation.market()).isEqualTo(RandomVariationStrategy.DEFAULT_MARKET);
        assertThat(variation.timeframe()).isEqualTo(RandomVariationStrategy.DEFAULT_TIMEFRAME);
      }
    }
  }
}
