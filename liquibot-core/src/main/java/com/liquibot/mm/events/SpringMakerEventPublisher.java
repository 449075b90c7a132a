package com.liquibot.mm.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Publishes {@link MakerEvent}s through the application context. Listener failures are logged and never reach
 * the publishing component.
 */
@Slf4j
public class SpringMakerEventPublisher implements MakerEventPublisher {

  private final ApplicationEventPublisher publisher;
  private final Clock clock;

  public SpringMakerEventPublisher(ApplicationEventPublisher publisher, Clock clock) {
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
    if (type == null || type.isBlank()) {
      return;
    }
    MakerEvent event = new MakerEvent(ts == null ? clock.instant() : ts, type, key, data);
    try {
      publisher.publishEvent(event);
    } catch (RuntimeException e) {
      log.warn("event listener failed for {} key={}: {}", type, key, e.getMessage());
    }
  }
}
