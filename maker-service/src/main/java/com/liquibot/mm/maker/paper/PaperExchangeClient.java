package com.liquibot.mm.maker.paper;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.domain.Trade;
import com.liquibot.mm.exchange.CancelOrderResponse;
import com.liquibot.mm.exchange.ExchangeClient;
import com.liquibot.mm.exchange.OpenOrder;
import com.liquibot.mm.exchange.OrderSpec;
import com.liquibot.mm.exchange.SubmitOrderResponse;
import com.liquibot.mm.exchange.TradeFilter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Paper exchange: market data comes from the real public book, the account's own orders and fills live in memory.
 *
 * <p>A resting paper order is filled in full at its limit price once a book read shows the opposite side crossing
 * it (best ask at or below a buy, best bid at or above a sell). Paper orders never appear in the public book.
 */
@Slf4j
public class PaperExchangeClient implements ExchangeClient {

    public static final String PAPER_ACCOUNT = "paper-account";

    private final ExchangeClient marketData;
    private final Clock clock;
    private final boolean fillsEnabled;
    private final BigDecimal defaultMinOrderSize;

    private final ConcurrentMap<String, PaperOrder> restingById = new ConcurrentHashMap<>();
    private final Set<String> filledIds = ConcurrentHashMap.newKeySet();
    private final List<Trade> trades = new CopyOnWriteArrayList<>();

    public PaperExchangeClient(ExchangeClient marketData, Clock clock, boolean fillsEnabled, BigDecimal defaultMinOrderSize) {
        this.marketData = Objects.requireNonNull(marketData, "marketData");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fillsEnabled = fillsEnabled;
        this.defaultMinOrderSize = defaultMinOrderSize == null ? BigDecimal.ZERO : defaultMinOrderSize;
    }

    @Override
    public SubmitOrderResponse submitOrder(OrderSpec spec) {
        if (spec.size().signum() <= 0) {
            return SubmitOrderResponse.rejected("size must be > 0");
        }
        if (spec.price().signum() <= 0 || spec.price().compareTo(BigDecimal.ONE) >= 0) {
            return SubmitOrderResponse.rejected("price must be within (0, 1)");
        }
        String orderId = "paper-" + UUID.randomUUID();
        restingById.put(orderId, new PaperOrder(orderId, spec.instrument(), spec.side(), spec.price(), spec.size()));
        log.debug("paper order {} {} {} {}@{}", orderId, spec.instrument(), spec.side(), spec.size(), spec.price());
        return SubmitOrderResponse.accepted(orderId, "live");
    }

    @Override
    public CancelOrderResponse cancelOrder(String orderId) {
        if (restingById.remove(orderId) != null) {
            return new CancelOrderResponse(Set.of(orderId), Map.of());
        }
        String reason = filledIds.contains(orderId) ? "order already matched" : "order not found";
        return new CancelOrderResponse(Set.of(), Map.of(orderId, reason));
    }

    /**
     * Reads the public book and fills any paper orders it crosses.
     */
    @Override
    public List<OpenOrder> listOpenOrders(String marketId, String tokenId) {
        List<OpenOrder> book = marketData.listOpenOrders(marketId, tokenId);
        if (fillsEnabled) {
            matchAgainst(tokenId, book);
        }
        return book;
    }

    @Override
    public List<OpenOrder> listOwnOpenOrders(String marketId, String tokenId) {
        List<OpenOrder> out = new ArrayList<>();
        for (PaperOrder order : restingById.values()) {
            if (matches(order.instrument(), marketId, tokenId)) {
                out.add(new OpenOrder(order.id(), order.instrument().marketId(), order.instrument().tokenId(),
                        order.side(), order.price(), order.size()));
            }
        }
        return out;
    }

    @Override
    public List<Trade> listTrades(TradeFilter filter) {
        List<Trade> out = new ArrayList<>();
        for (Trade trade : trades) {
            if ((filter.marketId() == null || filter.marketId().equals(trade.marketId()))
                    && (filter.tokenId() == null || filter.tokenId().equals(trade.tokenId()))) {
                out.add(trade);
            }
        }
        return out;
    }

    @Override
    public String getAccountAddress() {
        return PAPER_ACCOUNT;
    }

    @Override
    public BigDecimal getMinOrderSize(String marketId) {
        try {
            return marketData.getMinOrderSize(marketId);
        } catch (RuntimeException e) {
            log.debug("min order size of {} unavailable ({}), using paper default {}", marketId, e.getMessage(), defaultMinOrderSize);
            return defaultMinOrderSize;
        }
    }

    private void matchAgainst(String tokenId, List<OpenOrder> book) {
        BigDecimal bestBid = null;
        BigDecimal bestAsk = null;
        for (OpenOrder level : book == null ? List.<OpenOrder>of() : book) {
            if (level == null || level.price() == null) {
                continue;
            }
            if (level.side() == OrderSide.BUY) {
                bestBid = bestBid == null ? level.price() : bestBid.max(level.price());
            } else if (level.side() == OrderSide.SELL) {
                bestAsk = bestAsk == null ? level.price() : bestAsk.min(level.price());
            }
        }
        for (PaperOrder order : restingById.values()) {
            if (!order.instrument().tokenId().equals(tokenId)) {
                continue;
            }
            boolean crossed = order.side() == OrderSide.BUY
                    ? bestAsk != null && bestAsk.compareTo(order.price()) <= 0
                    : bestBid != null && bestBid.compareTo(order.price()) >= 0;
            if (crossed && restingById.remove(order.id()) != null) {
                filledIds.add(order.id());
                trades.add(new Trade(
                        "paper-trade-" + UUID.randomUUID(),
                        order.instrument().marketId(),
                        order.instrument().tokenId(),
                        order.side(),
                        order.size(),
                        order.price(),
                        Trade.STATUS_CONFIRMED,
                        clock.instant()
                ));
                log.info("paper fill {} {} {}@{}", order.id(), order.side(), order.size(), order.price());
            }
        }
    }

    private static boolean matches(Instrument instrument, String marketId, String tokenId) {
        return (marketId == null || instrument.marketId().equals(marketId))
                && (tokenId == null || instrument.tokenId().equals(tokenId));
    }

    private record PaperOrder(String id, Instrument instrument, OrderSide side, BigDecimal price, BigDecimal size) {
    }
}
