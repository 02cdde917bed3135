package com.verlumen.ideasearch.graph;

import com.google.common.collect.ImmutableSet;
import java.time.Instant;

/**
 * A node that can be tested by a backtest: an {@link Idea} or a {@link Scenario}. Subjects carry
 * the denormalized counters consumed by the bandit.
 */
public interface Subject {
  String id();

  NodeType type();

  String description();

  ImmutableSet<String> tags();

  Instant createdAt();

  /** Number of backtests credited to this subject. */
  long testCount();

  /** Sum of the scores of the backtests credited to this subject. */
  double totalScore();

  /** Returns a copy of this subject with the given counters. */
  Subject withStatistics(long testCount, double totalScore);

  default double meanScore() {
    return testCount() == 0 ? 0.0 : totalScore() / testCount();
  }
}
