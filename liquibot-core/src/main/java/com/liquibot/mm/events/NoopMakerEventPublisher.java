package com.liquibot.mm.events;

import java.time.Instant;

public final class NoopMakerEventPublisher implements MakerEventPublisher {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
  }
}
