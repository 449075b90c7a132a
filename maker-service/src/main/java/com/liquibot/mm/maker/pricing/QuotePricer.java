package com.liquibot.mm.maker.pricing;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.exchange.ExchangeClient;
import com.liquibot.mm.exchange.OpenOrder;
import com.liquibot.mm.maker.metrics.MakerMetrics;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Fair mid-price from the resting orders of all participants.
 *
 * <p>Best bid defaults to 0 and best ask to 1 when only one side is present. With an empty book, or when the
 * book cannot be read, the configured fallback (0.5 by default) is returned instead of an error.
 */
@Slf4j
public class QuotePricer {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final ExchangeClient exchange;
    private final BigDecimal fallbackMid;
    private final MakerMetrics metrics;

    public QuotePricer(ExchangeClient exchange, BigDecimal fallbackMid, MakerMetrics metrics) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.fallbackMid = fallbackMid == null ? new BigDecimal("0.5") : fallbackMid;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public BigDecimal midPrice(Instrument instrument) {
        return quote(instrument).price();
    }

    public MidPriceQuote quote(Instrument instrument) {
        List<OpenOrder> book;
        try {
            book = exchange.listOpenOrders(instrument.marketId(), instrument.tokenId());
        } catch (RuntimeException e) {
            log.warn("order book fetch failed for {}, using fallback mid {}: {}", instrument, fallbackMid, e.getMessage());
            metrics.midPriceFallback(MidPriceQuote.Source.FETCH_FAILED);
            return new MidPriceQuote(fallbackMid, null, null, MidPriceQuote.Source.FETCH_FAILED);
        }

        BigDecimal bestBid = null;
        BigDecimal bestAsk = null;
        for (OpenOrder order : book == null ? List.<OpenOrder>of() : book) {
            if (order == null || order.price() == null || order.side() == null) {
                continue;
            }
            if (order.side() == OrderSide.BUY) {
                bestBid = bestBid == null ? order.price() : bestBid.max(order.price());
            } else {
                bestAsk = bestAsk == null ? order.price() : bestAsk.min(order.price());
            }
        }

        if (bestBid == null && bestAsk == null) {
            log.debug("empty book for {}, using fallback mid {}", instrument, fallbackMid);
            metrics.midPriceFallback(MidPriceQuote.Source.EMPTY_BOOK);
            return new MidPriceQuote(fallbackMid, null, null, MidPriceQuote.Source.EMPTY_BOOK);
        }

        BigDecimal bid = bestBid == null ? BigDecimal.ZERO : bestBid;
        BigDecimal ask = bestAsk == null ? BigDecimal.ONE : bestAsk;
        return new MidPriceQuote(bid.add(ask).divide(TWO), bid, ask, MidPriceQuote.Source.BOOK);
    }
}
