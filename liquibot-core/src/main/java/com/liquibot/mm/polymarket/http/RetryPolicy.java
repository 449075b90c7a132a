package com.liquibot.mm.polymarket.http;

public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 1, 0, 0);
  }

  public int attempts() {
    return enabled ? Math.max(1, maxAttempts) : 1;
  }

  /**
   * Exponential backoff before retry number {@code attempt} (1-based), capped at {@code maxBackoffMillis}.
   */
  public long backoffMillis(int attempt) {
    if (attempt <= 0 || initialBackoffMillis <= 0) {
      return 0;
    }
    long backoff = initialBackoffMillis;
    for (int i = 1; i < attempt && backoff < maxBackoffMillis; i++) {
      backoff *= 2;
    }
    return Math.min(backoff, Math.max(initialBackoffMillis, maxBackoffMillis));
  }
}
