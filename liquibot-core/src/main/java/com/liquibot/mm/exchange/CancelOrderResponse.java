package com.liquibot.mm.exchange;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of a cancel request: the ids the exchange confirmed as canceled and the ones it refused, with reasons.
 */
public record CancelOrderResponse(Set<String> canceled, Map<String, String> notCanceled) {

  public CancelOrderResponse {
    canceled = canceled == null ? Set.of() : Set.copyOf(canceled);
    notCanceled = notCanceled == null ? Map.of() : Map.copyOf(notCanceled);
  }

  public boolean isCanceled(String orderId) {
    return orderId != null && canceled.contains(orderId);
  }

  public String reasonNotCanceled(String orderId) {
    return orderId == null ? null : notCanceled.get(orderId);
  }
}
