package com.verlumen.ideasearch.config;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.verlumen.ideasearch.bandit.UcbSelector;
import com.verlumen.ideasearch.scoring.WeightedScoreFunction;
import com.verlumen.ideasearch.search.SearchConfig;
import java.time.Duration;
import java.util.Map;

/** Settings for the whole engine, read from environment variables with built-in defaults. */
@AutoValue
public abstract class IdeaSearchConfig {
  static final String EXPLORATION_CONSTANT_ENV_VAR = "IDEASEARCH_EXPLORATION_CONSTANT";
  static final String BRANCHING_ALLOWANCE_ENV_VAR = "IDEASEARCH_BRANCHING_ALLOWANCE";
  static final String MAX_EXPANSION_ATTEMPTS_ENV_VAR = "IDEASEARCH_MAX_EXPANSION_ATTEMPTS";
  static final String SIMULATION_TIMEOUT_ENV_VAR = "IDEASEARCH_SIMULATION_TIMEOUT_SECONDS";
  static final String STORE_MAX_ATTEMPTS_ENV_VAR = "IDEASEARCH_STORE_MAX_ATTEMPTS";
  static final String STORE_INITIAL_BACKOFF_ENV_VAR = "IDEASEARCH_STORE_INITIAL_BACKOFF_MILLIS";
  static final String EMBEDDING_DIMENSION_ENV_VAR = "IDEASEARCH_EMBEDDING_DIMENSION";
  static final String SCORE_WEIGHTS_ENV_VAR = "IDEASEARCH_SCORE_WEIGHTS";

  public static final int DEFAULT_STORE_MAX_ATTEMPTS = 3;
  public static final long DEFAULT_STORE_INITIAL_BACKOFF_MILLIS = 100;
  public static final int DEFAULT_EMBEDDING_DIMENSION = 384;

  private static final Splitter.MapSplitter WEIGHT_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings().withKeyValueSeparator('=');

  public static Builder builder() {
    return new AutoValue_IdeaSearchConfig.Builder()
        .setExplorationConstant(UcbSelector.DEFAULT_EXPLORATION_CONSTANT)
        .setSearchConfig(SearchConfig.builder().build())
        .setStoreMaxAttempts(DEFAULT_STORE_MAX_ATTEMPTS)
        .setStoreInitialBackoffMillis(DEFAULT_STORE_INITIAL_BACKOFF_MILLIS)
        .setEmbeddingDimension(DEFAULT_EMBEDDING_DIMENSION)
        .setScoreWeights(WeightedScoreFunction.DEFAULT_WEIGHTS);
  }

  public static IdeaSearchConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads every setting from {@code env}, falling back to the default for unset or empty
   * variables.
   *
   * @throws IllegalArgumentException if a variable is set to a malformed or out of range value
   */
  public static IdeaSearchConfig fromEnvironment(Map<String, String> env) {
    SearchConfig.Builder search = SearchConfig.builder();
    String branching = env.get(BRANCHING_ALLOWANCE_ENV_VAR);
    if (!isNullOrEmpty(branching)) {
      search.setBranchingAllowance(parseInt(BRANCHING_ALLOWANCE_ENV_VAR, branching));
    }
    String attempts = env.get(MAX_EXPANSION_ATTEMPTS_ENV_VAR);
    if (!isNullOrEmpty(attempts)) {
      search.setMaxExpansionAttempts(parseInt(MAX_EXPANSION_ATTEMPTS_ENV_VAR, attempts));
    }
    String timeout = env.get(SIMULATION_TIMEOUT_ENV_VAR);
    if (!isNullOrEmpty(timeout)) {
      search.setSimulationTimeout(
          Duration.ofSeconds(parseInt(SIMULATION_TIMEOUT_ENV_VAR, timeout)));
    }

    Builder builder = builder().setSearchConfig(search.build());
    String exploration = env.get(EXPLORATION_CONSTANT_ENV_VAR);
    if (!isNullOrEmpty(exploration)) {
      builder.setExplorationConstant(parseDouble(EXPLORATION_CONSTANT_ENV_VAR, exploration));
    }
    String maxAttempts = env.get(STORE_MAX_ATTEMPTS_ENV_VAR);
    if (!isNullOrEmpty(maxAttempts)) {
      builder.setStoreMaxAttempts(parseInt(STORE_MAX_ATTEMPTS_ENV_VAR, maxAttempts));
    }
    String backoff = env.get(STORE_INITIAL_BACKOFF_ENV_VAR);
    if (!isNullOrEmpty(backoff)) {
      builder.setStoreInitialBackoffMillis(parseInt(STORE_INITIAL_BACKOFF_ENV_VAR, backoff));
    }
    String dimension = env.get(EMBEDDING_DIMENSION_ENV_VAR);
    if (!isNullOrEmpty(dimension)) {
      builder.setEmbeddingDimension(parseInt(EMBEDDING_DIMENSION_ENV_VAR, dimension));
    }
    String weights = env.get(SCORE_WEIGHTS_ENV_VAR);
    if (!isNullOrEmpty(weights)) {
      builder.setScoreWeights(parseWeights(weights));
    }
    return builder.build();
  }

  public abstract double explorationConstant();

  public abstract SearchConfig searchConfig();

  public abstract int storeMaxAttempts();

  public abstract long storeInitialBackoffMillis();

  public abstract int embeddingDimension();

  public abstract ImmutableMap<String, Double> scoreWeights();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setExplorationConstant(double explorationConstant);

    public abstract Builder setSearchConfig(SearchConfig searchConfig);

    public abstract Builder setStoreMaxAttempts(int storeMaxAttempts);

    public abstract Builder setStoreInitialBackoffMillis(long storeInitialBackoffMillis);

    public abstract Builder setEmbeddingDimension(int embeddingDimension);

    public abstract Builder setScoreWeights(Map<String, Double> scoreWeights);

    abstract IdeaSearchConfig autoBuild();

    public IdeaSearchConfig build() {
      IdeaSearchConfig config = autoBuild();
      if (!Double.isFinite(config.explorationConstant()) || config.explorationConstant() < 0) {
        throw new IllegalArgumentException(
            "Exploration constant must be a finite non-negative number: "
                + config.explorationConstant());
      }
      if (config.storeMaxAttempts() < 1) {
        throw new IllegalArgumentException(
            "Store attempts must be at least 1: " + config.storeMaxAttempts());
      }
      if (config.storeInitialBackoffMillis() < 1) {
        throw new IllegalArgumentException(
            "Store backoff must be positive: " + config.storeInitialBackoffMillis());
      }
      if (config.embeddingDimension() < 1) {
        throw new IllegalArgumentException(
            "Embedding dimension must be positive: " + config.embeddingDimension());
      }
      return config;
    }
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
    }
  }

  private static double parseDouble(String name, String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be a number, got: " + value, e);
    }
  }

  /** Parses {@code Sharpe=0.5,CAGR=0.3,MaxDrawdown=-0.2}. */
  private static ImmutableMap<String, Double> parseWeights(String value) {
    Map<String, String> entries;
    try {
      entries = WEIGHT_SPLITTER.split(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          SCORE_WEIGHTS_ENV_VAR + " must look like Sharpe=0.5,CAGR=0.3, got: " + value, e);
    }
    ImmutableMap.Builder<String, Double> weights = ImmutableMap.builder();
    entries.forEach(
        (metric, weight) -> weights.put(metric, parseDouble(SCORE_WEIGHTS_ENV_VAR, weight)));
    return weights.buildOrThrow();
  }
}
