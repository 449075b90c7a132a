package com.liquibot.mm.events;

public final class MakerEventTypes {

  private MakerEventTypes() {
  }

  public static final String ORDER_PLACED = "maker.order.placed";
  public static final String ORDER_FAILED = "maker.order.failed";
  public static final String ORDER_CANCELED = "maker.order.canceled";
  public static final String ORDER_UNKNOWN = "maker.order.unknown";
  public static final String ORDER_RECONCILED = "maker.order.reconciled";

  public static final String RUN_STARTED = "maker.run.started";
  public static final String RUN_FINISHED = "maker.run.finished";

  public static final String PNL_SNAPSHOT = "maker.pnl.snapshot";
}
