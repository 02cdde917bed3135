package com.verlumen.ideasearch.scoring;

/** Names of the backtest metrics the default score function reads. */
public final class Metrics {
  public static final String SHARPE = "Sharpe";
  public static final String CAGR = "CAGR";
  public static final String MAX_DRAWDOWN = "MaxDrawdown";

  private Metrics() {}
}
