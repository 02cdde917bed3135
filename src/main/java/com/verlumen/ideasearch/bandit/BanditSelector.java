package com.verlumen.ideasearch.bandit;

import java.util.List;
import java.util.Optional;

/** Chooses which of several arms to try next, balancing exploitation against exploration. */
public interface BanditSelector {
  /**
   * Returns the arm to try next.
   *
   * @throws IllegalArgumentException if {@code arms} is empty
   */
  Arm select(List<Arm> arms);

  /**
   * Returns the arm with the best observed mean, for reporting a final choice. Arms that have never
   * been tested are ignored, so the result is empty when none has.
   */
  Optional<Arm> bestByMean(List<Arm> arms);
}
