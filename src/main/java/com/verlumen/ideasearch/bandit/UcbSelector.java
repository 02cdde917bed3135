package com.verlumen.ideasearch.bandit;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * UCB1 selection. Each tested arm scores {@code mean + c * sqrt(ln(N) / n)} where {@code n} is the
 * arm's test count and {@code N} the total across the arms (at least 1). Untested arms always win,
 * and ties go to the lowest id.
 */
public final class UcbSelector implements BanditSelector {
  public static final double DEFAULT_EXPLORATION_CONSTANT = 1.0;

  private static final Comparator<Arm> BY_ID = Comparator.comparing(Arm::id);
  private static final Comparator<Arm> BY_MEAN =
      Comparator.comparingDouble(Arm::meanScore)
          .thenComparingLong(Arm::testCount)
          .thenComparing(BY_ID.reversed());

  public static UcbSelector create() {
    return create(DEFAULT_EXPLORATION_CONSTANT);
  }

  public static UcbSelector create(double explorationConstant) {
    checkArgument(
        Double.isFinite(explorationConstant) && explorationConstant >= 0,
        "Exploration constant must be a finite non-negative number: %s",
        explorationConstant);
    return new UcbSelector(explorationConstant);
  }

  private final double explorationConstant;

  private UcbSelector(double explorationConstant) {
    this.explorationConstant = explorationConstant;
  }

  @Override
  public Arm select(List<Arm> arms) {
    checkArgument(!arms.isEmpty(), "Cannot select from an empty set of arms");
    ImmutableList<Arm> sorted = ImmutableList.sortedCopyOf(BY_ID, arms);
    for (Arm arm : sorted) {
      if (arm.testCount() == 0) {
        return arm;
      }
    }

    long parentVisits = Math.max(1, sorted.stream().mapToLong(Arm::testCount).sum());
    Arm best = sorted.get(0);
    double bestScore = ucbScore(best, parentVisits);
    for (Arm arm : sorted.subList(1, sorted.size())) {
      double score = ucbScore(arm, parentVisits);
      if (score > bestScore) {
        best = arm;
        bestScore = score;
      }
    }
    return best;
  }

  @Override
  public Optional<Arm> bestByMean(List<Arm> arms) {
    return arms.stream().filter(arm -> arm.testCount() > 0).max(BY_MEAN);
  }

  /** UCB1 score of a tested arm. */
  public double ucbScore(Arm arm, long parentVisits) {
    checkArgument(arm.testCount() > 0, "UCB is undefined for untested arm %s", arm.id());
    checkArgument(parentVisits > 0, "Parent visits must be positive: %s", parentVisits);
    double exploration =
        explorationConstant * Math.sqrt(Math.log(parentVisits) / arm.testCount());
    return arm.meanScore() + exploration;
  }

  public double explorationConstant() {
    return explorationConstant;
  }
}
