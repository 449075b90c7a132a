package com.liquibot.mm.maker.web;

import com.liquibot.mm.config.MakerProperties;
import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.maker.strategy.RunRejectedException;
import com.liquibot.mm.maker.strategy.RunSummary;
import com.liquibot.mm.maker.strategy.StrategyRunRegistry;
import com.liquibot.mm.maker.strategy.StrategyState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class StrategyControllerTest {

    @Mock
    private StrategyRunRegistry runs;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        MakerProperties properties = new MakerProperties(null, null, null, null, null, null);
        mvc = MockMvcBuilders.standaloneSetup(new StrategyController(properties, runs))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void startAppliesConfiguredDefaults() throws Exception {
        when(runs.start(any(), any(), any(), any())).thenReturn(summary("r1"));

        mvc.perform(post("/api/strategy/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"marketId\":\"m1\",\"tokenId\":\"t1\",\"riskAmount\":20}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("r1"))
                .andExpect(jsonPath("$.state").value("RUNNING"));

        verify(runs).start(new Instrument("m1", "t1"), new BigDecimal("20"), new BigDecimal("0.03"), Duration.ofMinutes(60));
    }

    @Test
    void invalidBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/strategy/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"marketId\":\"m1\",\"tokenId\":\"t1\",\"riskAmount\":-1,\"maxSpread\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verify(runs, never()).start(any(), any(), any(), any());
    }

    @Test
    void durationBeyondLimitIsBadRequest() throws Exception {
        mvc.perform(post("/api/strategy/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"marketId\":\"m1\",\"tokenId\":\"t1\",\"riskAmount\":20,\"durationMinutes\":1000000000000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("durationMinutes")));

        verify(runs, never()).start(any(), any(), any(), any());
    }

    @Test
    void conflictingRunIsRejected() throws Exception {
        when(runs.start(any(), any(), any(), any())).thenThrow(new RunRejectedException("instrument m1:t1 is already quoted"));

        mvc.perform(post("/api/strategy/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"marketId\":\"m1\",\"tokenId\":\"t1\",\"riskAmount\":20,\"durationMinutes\":5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("instrument m1:t1 is already quoted"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        when(runs.find("nope")).thenReturn(Optional.empty());
        when(runs.stop("nope")).thenReturn(Optional.empty());

        mvc.perform(get("/api/strategy/runs/nope")).andExpect(status().isNotFound());
        mvc.perform(delete("/api/strategy/runs/nope")).andExpect(status().isNotFound());
    }

    @Test
    void statusListsRuns() throws Exception {
        when(runs.activeCount()).thenReturn(1);
        when(runs.summaries()).thenReturn(List.of(summary("r1")));

        mvc.perform(get("/api/strategy/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("PAPER"))
                .andExpect(jsonPath("$.activeRuns").value(1))
                .andExpect(jsonPath("$.runs[0].runId").value("r1"));
    }

    @Test
    void stopReturnsSummary() throws Exception {
        when(runs.stop(eq("r1"))).thenReturn(Optional.of(summary("r1")));

        mvc.perform(delete("/api/strategy/runs/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("r1"));
    }

    private static RunSummary summary(String runId) {
        Instant started = Instant.parse("2024-01-15T10:00:00Z");
        return new RunSummary(runId, "m1", "t1", StrategyState.RUNNING, BigDecimal.TEN, new BigDecimal("0.03"),
                started, started.plus(Duration.ofMinutes(60)), null, 0, 0, 0, 0, null, null, null, null, false);
    }
}
