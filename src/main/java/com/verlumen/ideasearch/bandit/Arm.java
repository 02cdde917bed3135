package com.verlumen.ideasearch.bandit;

import com.google.auto.value.AutoValue;
import com.verlumen.ideasearch.graph.Subject;

/** The statistics of one candidate the bandit can pick. */
@AutoValue
public abstract class Arm {
  public static Arm create(String id, long testCount, double totalScore) {
    return new AutoValue_Arm(id, testCount, totalScore);
  }

  public static Arm fromSubject(Subject subject) {
    return create(subject.id(), subject.testCount(), subject.totalScore());
  }

  public abstract String id();

  public abstract long testCount();

  public abstract double totalScore();

  public double meanScore() {
    return testCount() == 0 ? 0.0 : totalScore() / testCount();
  }
}
