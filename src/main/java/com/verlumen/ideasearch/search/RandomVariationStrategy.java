package com.verlumen.ideasearch.search;

import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * Proposes variations without a language model: either moves the strategy to a random market and
 * timeframe, or sets one trading parameter to a random value. The market, timeframe and
 * parameters of a subject are carried in its tags as {@code market:BTC}, {@code timeframe:DAILY}
 * and {@code param:lookback=20}.
 */
public final class RandomVariationStrategy implements ExpansionStrategy {
  static final ImmutableList<String> MARKETS =
      ImmutableList.of("BTC", "ETH", "SOL", "AAPL", "MSFT", "SPY");
  static final ImmutableList<String> TIMEFRAMES =
      ImmutableList.of("DAILY", "HOURLY", "15MIN", "5MIN", "1MIN");
  static final String DEFAULT_MARKET = "BTC";
  static final String DEFAULT_TIMEFRAME = "DAILY";
  static final String MARKET_TAG = "market:";
  static final String TIMEFRAME_TAG = "timeframe:";
  static final String PARAMETER_TAG = "param:";

  public static RandomVariationStrategy create(Random random) {
    return new RandomVariationStrategy(random);
  }

  private final Random random;

  private RandomVariationStrategy(Random random) {
    this.random = random;
  }

  @Override
  public synchronized Variation proposeVariation(
      String parentDescription, ImmutableSet<String> parentTags) {
    String market = tagValue(parentTags, MARKET_TAG).orElse(DEFAULT_MARKET);
    String timeframe = tagValue(parentTags, TIMEFRAME_TAG).orElse(DEFAULT_TIMEFRAME);
    if (random.nextBoolean()) {
      String newMarket = pick(MARKETS);
      String newTimeframe = pick(TIMEFRAMES);
      ImmutableSet<String> tags =
          ImmutableSet.<String>builder()
              .addAll(withoutPrefix(withoutPrefix(parentTags, MARKET_TAG), TIMEFRAME_TAG))
              .add(MARKET_TAG + newMarket)
              .add(TIMEFRAME_TAG + newTimeframe)
              .build();
      return Variation.create(
          parentDescription + " on " + newMarket + " " + newTimeframe,
          tags,
          newMarket,
          newTimeframe);
    }

    Parameter parameter = Parameter.values()[random.nextInt(Parameter.values().length)];
    String setting = parameter.key + "=" + parameter.sample(random);
    ImmutableSet<String> tags =
        ImmutableSet.<String>builder()
            .addAll(withoutPrefix(parentTags, PARAMETER_TAG + parameter.key + "="))
            .add(PARAMETER_TAG + setting)
            .build();
    return Variation.create(parentDescription + " with " + setting, tags, market, timeframe);
  }

  private String pick(ImmutableList<String> values) {
    return values.get(random.nextInt(values.size()));
  }

  private static Optional<String> tagValue(ImmutableSet<String> tags, String prefix) {
    return tags.stream()
        .filter(tag -> tag.startsWith(prefix))
        .map(tag -> tag.substring(prefix.length()))
        .filter(value -> !value.isEmpty())
        .findFirst();
  }

  private static ImmutableSet<String> withoutPrefix(ImmutableSet<String> tags, String prefix) {
    return tags.stream().filter(tag -> !tag.startsWith(prefix)).collect(toImmutableSet());
  }

  private enum Parameter {
    LOOKBACK("lookback", 5, 200, true),
    THRESHOLD("threshold", 0.1, 5.0, false),
    STOP_LOSS("stop_loss", 0.01, 0.1, false),
    TAKE_PROFIT("take_profit", 0.02, 0.2, false),
    POSITION_SIZE("position_size", 0.1, 1.0, false);

    private final String key;
    private final double min;
    private final double max;
    private final boolean integral;

    Parameter(String key, double min, double max, boolean integral) {
      this.key = key;
      this.min = min;
      this.max = max;
      this.integral = integral;
    }

    private String sample(Random random) {
      if (integral) {
        return Integer.toString((int) min + random.nextInt((int) (max - min) + 1));
      }
      return String.format(Locale.ROOT, "%.3f", min + random.nextDouble() * (max - min));
    }
  }
}
