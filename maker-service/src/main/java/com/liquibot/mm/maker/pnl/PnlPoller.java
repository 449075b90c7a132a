package com.liquibot.mm.maker.pnl;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "maker.pnl", name = "poll-enabled", havingValue = "true", matchIfMissing = true)
public class PnlPoller {

    private final @NonNull PnlTracker pnlTracker;

    @Scheduled(initialDelayString = "${maker.pnl.poll-millis:60000}", fixedDelayString = "${maker.pnl.poll-millis:60000}")
    public void poll() {
        pnlTracker.snapshot();
    }
}
