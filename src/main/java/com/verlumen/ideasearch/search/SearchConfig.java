package com.verlumen.ideasearch.search;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

/** Tuning of the tree search. */
@AutoValue
public abstract class SearchConfig {
  public static final int DEFAULT_BRANCHING_ALLOWANCE = 3;
  public static final int DEFAULT_MAX_EXPANSION_ATTEMPTS = 5;
  public static final Duration DEFAULT_SIMULATION_TIMEOUT = Duration.ofHours(1);

  public static Builder builder() {
    return new AutoValue_SearchConfig.Builder()
        .setBranchingAllowance(DEFAULT_BRANCHING_ALLOWANCE)
        .setMaxExpansionAttempts(DEFAULT_MAX_EXPANSION_ATTEMPTS)
        .setSimulationTimeout(DEFAULT_SIMULATION_TIMEOUT);
  }

  /** Children a node must have before selection descends past it instead of expanding it. */
  public abstract int branchingAllowance();

  /** Proposals requested before giving up on finding a description new to the node. */
  public abstract int maxExpansionAttempts();

  public abstract Duration simulationTimeout();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setBranchingAllowance(int branchingAllowance);

    public abstract Builder setMaxExpansionAttempts(int maxExpansionAttempts);

    public abstract Builder setSimulationTimeout(Duration simulationTimeout);

    abstract SearchConfig autoBuild();

    public SearchConfig build() {
      SearchConfig config = autoBuild();
      checkArgument(
          config.branchingAllowance() > 0,
          "Branching allowance must be positive: %s",
          config.branchingAllowance());
      checkArgument(
          config.maxExpansionAttempts() > 0,
          "Max expansion attempts must be positive: %s",
          config.maxExpansionAttempts());
      checkArgument(
          !config.simulationTimeout().isNegative() && !config.simulationTimeout().isZero(),
          "Simulation timeout must be positive: %s",
          config.simulationTimeout());
      return config;
    }
  }
}
