package com.verlumen.ideasearch.errors;

/**
 * Signals that a backtest simulation did not produce metrics, either because the runner crashed or
 * because it exceeded its time limit. A failed simulation is never recorded as a result.
 */
public class SimulationFailureException extends Exception {
  private final boolean retryable;

  public SimulationFailureException(String message, boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  public SimulationFailureException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  /** Whether running the same simulation again may succeed, as with a timeout. */
  public boolean isRetryable() {
    return retryable;
  }
}
