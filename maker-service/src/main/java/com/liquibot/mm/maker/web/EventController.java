package com.liquibot.mm.maker.web;

import com.liquibot.mm.events.MakerEvent;
import com.liquibot.mm.maker.events.RecentMakerEvents;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final @NonNull RecentMakerEvents events;

    @GetMapping
    public List<MakerEvent> recent(
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "limit", defaultValue = "100") int limit
    ) {
        return events.recent(type, limit);
    }
}
