package com.liquibot.mm.maker.events;

import com.liquibot.mm.events.MakerEvent;
import com.liquibot.mm.events.MakerEventsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent {@link MakerEvent}s in memory, newest last.
 */
@Slf4j
@Component
public class RecentMakerEvents {

    private final int retained;
    private final Deque<MakerEvent> events = new ArrayDeque<>();

    public RecentMakerEvents(MakerEventsProperties properties) {
        this.retained = properties.retained();
    }

    @EventListener
    public void onEvent(MakerEvent event) {
        log.debug("event {} key={}", event.type(), event.key());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > retained) {
                events.removeFirst();
            }
        }
    }

    /**
     * @param type only events of this type, or all when null or blank
     * @param limit at most this many of the newest matching events
     */
    public List<MakerEvent> recent(String type, int limit) {
        List<MakerEvent> out = new ArrayList<>();
        synchronized (events) {
            for (MakerEvent event : events) {
                if (type == null || type.isBlank() || type.equals(event.type())) {
                    out.add(event);
                }
            }
        }
        int from = Math.max(0, out.size() - Math.max(0, limit));
        return List.copyOf(out.subList(from, out.size()));
    }
}
