package com.verlumen.ideasearch.scoring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Linear combination of named metrics. A metric absent from the backtest contributes 0.
 *
 * <p>The default weights reward risk-adjusted return and growth and penalize drawdown:
 * {@code 0.5 * Sharpe + 0.3 * CAGR - 0.2 * MaxDrawdown}.
 */
public final class WeightedScoreFunction implements ScoreFunction {
  public static final ImmutableMap<String, Double> DEFAULT_WEIGHTS =
      ImmutableMap.of(Metrics.SHARPE, 0.5, Metrics.CAGR, 0.3, Metrics.MAX_DRAWDOWN, -0.2);

  public static WeightedScoreFunction create() {
    return create(DEFAULT_WEIGHTS);
  }

  public static WeightedScoreFunction create(Map<String, Double> weights) {
    checkArgument(!weights.isEmpty(), "At least one metric weight is required");
    weights.forEach(
        (metric, weight) ->
            checkArgument(Double.isFinite(weight), "Weight for %s is not finite", metric));
    return new WeightedScoreFunction(ImmutableMap.copyOf(weights));
  }

  private final ImmutableMap<String, Double> weights;

  private WeightedScoreFunction(ImmutableMap<String, Double> weights) {
    this.weights = weights;
  }

  @Override
  public double score(Map<String, Double> metrics) {
    double score = 0.0;
    for (Map.Entry<String, Double> weight : weights.entrySet()) {
      Double value = metrics.get(weight.getKey());
      if (value != null) {
        score += weight.getValue() * value;
      }
    }
    return score;
  }

  public ImmutableMap<String, Double> weights() {
    return weights;
  }
}
