package com.verlumen.ideasearch.scoring;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class WeightedScoreFunctionTest {
  @Inject private ScoreFunction scoreFunction;

  @Before
  public void setUp() {
    Guice.createInjector(ScoringModule.create()).injectMembers(this);
  }

  @Test
  public void score_defaultWeights_combinesSharpeCagrAndDrawdown() {
    // Arrange
    ImmutableMap<String, Double> metrics =
        ImmutableMap.of(Metrics.SHARPE, 1.2, Metrics.CAGR, 0.18, Metrics.MAX_DRAWDOWN, 0.1);

    // Act
    double score = scoreFunction.score(metrics);

    // Assert
    assertThat(score).isWithin(1e-9).of(0.634);
  }

  @Test
  public void score_missingMetrics_countAsZero() {
    assertThat(scoreFunction.score(ImmutableMap.of(Metrics.SHARPE, 2.0))).isWithin(1e-9).of(1.0);
    assertThat(scoreFunction.score(ImmutableMap.of())).isEqualTo(0.0);
  }

  @Test
  public void score_ignoresUnweightedMetrics() {
    assertThat(scoreFunction.score(ImmutableMap.of("WinRate", 0.9))).isEqualTo(0.0);
  }

  @Test
  public void score_customWeights_areApplied() {
    // Arrange
    WeightedScoreFunction custom = WeightedScoreFunction.create(ImmutableMap.of("Sortino", 2.0));

    // Act & Assert
    assertThat(custom.score(ImmutableMap.of("Sortino", 1.5, Metrics.SHARPE, 3.0)))
        .isWithin(1e-9)
        .of(3.0);
  }

  @Test
  public void create_nonFiniteWeight_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> WeightedScoreFunction.create(ImmutableMap.of(Metrics.SHARPE, Double.NaN)));
  }
}
