package com.liquibot.mm.exchange;

public record SubmitOrderResponse(
    boolean success,
    String orderId,
    String status,
    String errorMessage
) {

  public static SubmitOrderResponse accepted(String orderId, String status) {
    return new SubmitOrderResponse(true, orderId, status, null);
  }

  public static SubmitOrderResponse rejected(String errorMessage) {
    return new SubmitOrderResponse(false, null, null, errorMessage);
  }

  public boolean hasOrderId() {
    return orderId != null && !orderId.isBlank();
  }
}
