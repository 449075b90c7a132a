package com.liquibot.mm.events;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix="maker.events")
public record MakerEventsProperties(
    @NotNull Boolean enabled,
    /**
     * How many recent events the service keeps for {@code GET /api/events}.
     */
    @NotNull @Min(1) Integer retained
) {
  public MakerEventsProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (retained == null) {
      retained = 500;
    }
  }
}
