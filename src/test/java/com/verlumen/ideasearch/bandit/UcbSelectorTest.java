package com.verlumen.ideasearch.bandit;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class UcbSelectorTest {
  @Inject private BanditSelector selector;

  @Before
  public void setUp() {
    Guice.createInjector(BanditModule.create()).injectMembers(this);
  }

  @Test
  public void select_untestedArm_isPreferredForAnyExplorationConstant() {
    // Arrange
    ImmutableList<Arm> arms = ImmutableList.of(Arm.create("B", 5, 4.0), Arm.create("A", 0, 0.0));

    // Act & Assert
    for (double c : new double[] {0.0, 0.5, 1.0, 100.0}) {
      assertThat(UcbSelector.create(c).select(arms).id()).isEqualTo("A");
    }
  }

  @Test
  public void select_severalUntestedArms_picksLowestId() {
    // Arrange
    ImmutableList<Arm> arms =
        ImmutableList.of(
            Arm.create("scenario-c", 0, 0.0),
            Arm.create("scenario-a", 0, 0.0),
            Arm.create("scenario-b", 3, 9.0));

    // Act & Assert
    assertThat(selector.select(arms).id()).isEqualTo("scenario-a");
  }

  @Test
  public void select_equalScores_picksLowestId() {
    // Arrange
    ImmutableList<Arm> arms = ImmutableList.of(Arm.create("y", 2, 1.0), Arm.create("x", 2, 1.0));

    // Act & Assert
    assertThat(selector.select(arms).id()).isEqualTo("x");
  }

  @Test
  public void select_zeroExploration_picksHighestMean() {
    // Arrange
    ImmutableList<Arm> arms =
        ImmutableList.of(Arm.create("a", 10, 5.0), Arm.create("b", 1, 0.9));

    // Act & Assert
    assertThat(UcbSelector.create(0.0).select(arms).id()).isEqualTo("b");
  }

  @Test
  public void select_explorationBonus_favoursRarelyTestedArm() {
    // Arrange: means 0.6 and 0.5, but b has only one test out of 101.
    ImmutableList<Arm> arms =
        ImmutableList.of(Arm.create("a", 100, 60.0), Arm.create("b", 1, 0.5));

    // Act & Assert
    assertThat(UcbSelector.create(1.0).select(arms).id()).isEqualTo("b");
  }

  @Test
  public void ucbScore_matchesFormula() {
    // Arrange
    UcbSelector ucb = UcbSelector.create(2.0);

    // Act
    double score = ucb.ucbScore(Arm.create("a", 4, 2.0), 16);

    // Assert
    assertThat(score).isWithin(1e-9).of(0.5 + 2.0 * Math.sqrt(Math.log(16) / 4));
  }

  @Test
  public void select_emptyArms_throws() {
    assertThrows(IllegalArgumentException.class, () -> selector.select(ImmutableList.of()));
  }

  @Test
  public void create_negativeExplorationConstant_throws() {
    assertThrows(IllegalArgumentException.class, () -> UcbSelector.create(-1.0));
  }

  @Test
  public void bestByMean_prefersMeanThenTestCountThenId() {
    // Arrange
    ImmutableList<Arm> arms =
        ImmutableList.of(
            Arm.create("c", 0, 0.0),
            Arm.create("b", 4, 2.0),
            Arm.create("a", 2, 1.0),
            Arm.create("d", 4, 2.0));

    // Act & Assert
    assertThat(selector.bestByMean(arms).get().id()).isEqualTo("b");
  }

  @Test
  public void bestByMean_noTestedArms_returnsEmpty() {
    assertThat(selector.bestByMean(ImmutableList.of(Arm.create("a", 0, 0.0)))).isEmpty();
  }
}
