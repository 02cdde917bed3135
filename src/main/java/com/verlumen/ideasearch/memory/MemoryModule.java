package com.verlumen.ideasearch.memory;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.ideasearch.errors.StoreUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;

@AutoValue
public abstract class MemoryModule extends AbstractModule {
  private static final double BACKOFF_MULTIPLIER = 2.0;

  public static MemoryModule create(int storeMaxAttempts, long storeInitialBackoffMillis) {
    return new AutoValue_MemoryModule(storeMaxAttempts, storeInitialBackoffMillis);
  }

  abstract int storeMaxAttempts();

  abstract long storeInitialBackoffMillis();

  @Override
  protected void configure() {
    bind(HybridMemory.class).to(HybridMemoryImpl.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  Clock provideClock() {
    return Clock.systemUTC();
  }

  @Provides
  @Singleton
  Retry provideStoreRetry() {
    return storeRetry(storeMaxAttempts(), storeInitialBackoffMillis());
  }

  /** Retries {@link StoreUnavailableException} only, with exponential backoff. */
  static Retry storeRetry(int maxAttempts, long initialBackoffMillis) {
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(initialBackoffMillis, BACKOFF_MULTIPLIER))
            .retryExceptions(StoreUnavailableException.class)
            .build();
    return Retry.of("store", config);
  }
}
