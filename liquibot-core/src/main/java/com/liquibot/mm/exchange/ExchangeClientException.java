package com.liquibot.mm.exchange;

/**
 * Any transport, auth or logic failure of an exchange call.
 */
public class ExchangeClientException extends RuntimeException {

  private final int statusCode;

  public ExchangeClientException(String message) {
    this(message, -1, null);
  }

  public ExchangeClientException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public ExchangeClientException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * HTTP status of the failed call, or -1 when the request never got a response.
   */
  public int statusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return statusCode < 0 || statusCode == 429 || statusCode >= 500;
  }
}
