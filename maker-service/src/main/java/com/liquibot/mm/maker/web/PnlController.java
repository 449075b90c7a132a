package com.liquibot.mm.maker.web;

import com.liquibot.mm.maker.pnl.PnlSnapshot;
import com.liquibot.mm.maker.pnl.PnlTracker;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/pnl")
@RequiredArgsConstructor
public class PnlController {

    private final @NonNull PnlTracker pnlTracker;

    @GetMapping
    public List<PnlSnapshot> history() {
        return pnlTracker.history();
    }

    @PostMapping("/snapshot")
    public ResponseEntity<PnlSnapshot> snapshot() {
        return pnlTracker.snapshot()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.BAD_GATEWAY).build());
    }
}
