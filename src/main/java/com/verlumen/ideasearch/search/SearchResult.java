package com.verlumen.ideasearch.search;

import com.google.auto.value.AutoValue;
import com.verlumen.ideasearch.bandit.Arm;
import java.util.Optional;

/** Summary of one tree search run. */
@AutoValue
public abstract class SearchResult {
  public static SearchResult create(
      String rootId, int iterations, int succeeded, int failed, Optional<Arm> bestChild) {
    return new AutoValue_SearchResult(rootId, iterations, succeeded, failed, bestChild);
  }

  public abstract String rootId();

  /** Iterations attempted; fewer than requested if the search was interrupted. */
  public abstract int iterations();

  public abstract int succeeded();

  public abstract int failed();

  /** The root's child with the best mean score, if any child has been tested. */
  public abstract Optional<Arm> bestChild();
}
