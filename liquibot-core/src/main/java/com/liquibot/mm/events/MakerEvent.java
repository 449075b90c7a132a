package com.liquibot.mm.events;

import java.time.Instant;

/**
 * One published event, delivered to Spring listeners when {@code maker.events.enabled=true}.
 */
public record MakerEvent(Instant ts, String type, String key, Object data) {
}
