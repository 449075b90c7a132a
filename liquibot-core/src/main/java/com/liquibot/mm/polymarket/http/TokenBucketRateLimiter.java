package com.liquibot.mm.polymarket.http;

import com.liquibot.mm.exchange.ExchangeClientException;

import java.time.Clock;

/**
 * Token bucket shared by every caller of one transport. Blocks the calling thread until a token is available.
 */
public final class TokenBucketRateLimiter implements RequestRateLimiter {

  private final double tokensPerMilli;
  private final double capacity;
  private final Clock clock;

  private double available;
  private long lastRefillMillis;

  public TokenBucketRateLimiter(double requestsPerSecond, int burst, Clock clock) {
    if (requestsPerSecond <= 0) {
      throw new IllegalArgumentException("requestsPerSecond must be > 0");
    }
    if (burst <= 0) {
      throw new IllegalArgumentException("burst must be > 0");
    }
    this.tokensPerMilli = requestsPerSecond / 1_000.0;
    this.capacity = burst;
    this.clock = clock;
    this.available = burst;
    this.lastRefillMillis = clock.millis();
  }

  @Override
  public void acquire() {
    long waitMillis;
    while ((waitMillis = tryAcquire()) > 0) {
      try {
        Thread.sleep(waitMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ExchangeClientException("interrupted while waiting for rate limiter", e);
      }
    }
  }

  /**
   * @return 0 when a token was taken, otherwise the millis to wait before trying again
   */
  synchronized long tryAcquire() {
    refill();
    if (available >= 1.0) {
      available -= 1.0;
      return 0;
    }
    double missing = 1.0 - available;
    return Math.max(1L, (long) Math.ceil(missing / tokensPerMilli));
  }

  private void refill() {
    long now = clock.millis();
    long elapsed = now - lastRefillMillis;
    if (elapsed <= 0) {
      return;
    }
    available = Math.min(capacity, available + elapsed * tokensPerMilli);
    lastRefillMillis = now;
  }
}
