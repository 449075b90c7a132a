package com.liquibot.mm.polymarket.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquibot.mm.exchange.ExchangeClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * Sends JSON requests with rate limiting and bounded retries. Thread-safe.
 */
@Slf4j
public final class PolymarketHttpTransport {

  private static final int MAX_ERROR_BODY_CHARS = 500;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;
  private final RetryPolicy retry;

  public PolymarketHttpTransport(HttpClient httpClient, ObjectMapper objectMapper, RequestRateLimiter rateLimiter, RetryPolicy retry) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.rateLimiter = rateLimiter == null ? RequestRateLimiter.noop() : rateLimiter;
    this.retry = retry == null ? RetryPolicy.disabled() : retry;
  }

  public <T> T sendJson(HttpRequest request, Class<T> responseType) {
    String body = send(request);
    if (body == null || body.isBlank()) {
      body = "null";
    }
    try {
      return objectMapper.readValue(body, responseType);
    } catch (IOException e) {
      throw new ExchangeClientException("Failed parsing response of %s %s".formatted(request.method(), request.uri().getPath()), e);
    }
  }

  public String send(HttpRequest request) {
    int attempts = retry.attempts();
    ExchangeClientException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      if (attempt > 1) {
        sleepBackoff(retry.backoffMillis(attempt - 1));
      }
      try {
        return sendOnce(request);
      } catch (ExchangeClientException e) {
        last = e;
        if (!e.isRetryable() || attempt == attempts) {
          throw e;
        }
        log.debug("retrying {} {} after failure (attempt {}/{}): {}",
            request.method(), request.uri().getPath(), attempt, attempts, e.getMessage());
      }
    }
    throw last;
  }

  private String sendOnce(HttpRequest request) {
    rateLimiter.acquire();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new ExchangeClientException("%s %s failed: %s".formatted(request.method(), request.uri().getPath(), e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExchangeClientException("interrupted during %s %s".formatted(request.method(), request.uri().getPath()), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new ExchangeClientException(
          "%s %s returned HTTP %d: %s".formatted(request.method(), request.uri().getPath(), status, truncate(response.body())),
          status,
          null
      );
    }
    return response.body();
  }

  private static void sleepBackoff(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExchangeClientException("interrupted during retry backoff", e);
    }
  }

  private static String truncate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
  }
}
