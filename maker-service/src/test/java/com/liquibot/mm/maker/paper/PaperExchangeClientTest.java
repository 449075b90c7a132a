package com.liquibot.mm.maker.paper;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.domain.Trade;
import com.liquibot.mm.exchange.CancelOrderResponse;
import com.liquibot.mm.exchange.OpenOrder;
import com.liquibot.mm.exchange.OrderSpec;
import com.liquibot.mm.exchange.SubmitOrderResponse;
import com.liquibot.mm.exchange.TradeFilter;
import com.liquibot.mm.maker.support.FakeExchangeClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.liquibot.mm.maker.support.FakeExchangeClient.level;
import static org.assertj.core.api.Assertions.assertThat;

class PaperExchangeClientTest {

    private static final Instrument INSTRUMENT = new Instrument("m1", "t1");
    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private FakeExchangeClient marketData;
    private PaperExchangeClient paper;

    @BeforeEach
    void setUp() {
        marketData = new FakeExchangeClient();
        marketData.book.add(level(OrderSide.BUY, "0.45"));
        marketData.book.add(level(OrderSide.SELL, "0.55"));
        paper = new PaperExchangeClient(marketData, Clock.fixed(NOW, ZoneOffset.UTC), true, new BigDecimal("5"));
    }

    @Test
    void acceptedOrdersRestAsOwnOrdersButStayOffThePublicBook() {
        SubmitOrderResponse response = paper.submitOrder(OrderSpec.limit(INSTRUMENT, OrderSide.BUY, new BigDecimal("0.40"), BigDecimal.TEN, 0));

        assertThat(response.success()).isTrue();
        assertThat(response.orderId()).startsWith("paper-");
        assertThat(paper.listOwnOpenOrders("m1", "t1")).extracting(OpenOrder::id).containsExactly(response.orderId());
        assertThat(paper.listOwnOpenOrders("m2", null)).isEmpty();
        assertThat(paper.listOpenOrders("m1", "t1")).hasSize(2);
        assertThat(marketData.submitted).isEmpty();
    }

    @Test
    void rejectsPricesOutsideUnitInterval() {
        assertThat(paper.submitOrder(OrderSpec.limit(INSTRUMENT, OrderSide.BUY, BigDecimal.ONE, BigDecimal.TEN, 0)).success()).isFalse();
        assertThat(paper.submitOrder(OrderSpec.limit(INSTRUMENT, OrderSide.SELL, new BigDecimal("0.5"), BigDecimal.ZERO, 0)).success()).isFalse();
    }

    @Test
    void crossingBookFillsOrderAtItsLimitPrice() {
        String buyId = paper.submitOrder(OrderSpec.limit(INSTRUMENT, OrderSide.BUY, new BigDecimal("0.50"), BigDecimal.TEN, 0)).orderId();
        String sellId = paper.submitOrder(OrderSpec.limit(INSTRUMENT, OrderSide.SELL, new BigDecimal("0.60"), BigDecimal.TEN, 0)).orderId();

        marketData.book.clear();
        marketData.book.add(level(OrderSide.SELL, "0.49"));
        paper.listOpenOrders("m1", "t1");

        List<Trade> trades = paper.listTrades(TradeFilter.forMaker(paper.getAccountAddress()));
        assertThat(trades).singleElement().satisfies(trade -> {
            assertThat(trade.side()).isEqualTo(OrderSide.BUY);
            assertThat(trade.price()).isEqualByComparingTo("0.50");
            assertThat(trade.size()).isEqualByComparingTo("10");
            assertThat(trade.isConfirmed()).isTrue();
            assertThat(trade.matchTime()).isEqualTo(NOW);
        });
        assertThat(paper.listOwnOpenOrders("m1", "t1")).extracting(OpenOrder::id).containsExactly(sellId);

        CancelOrderResponse cancelFilled = paper.cancelOrder(buyId);
        assertThat(cancelFilled.isCanceled(buyId)).isFalse();
        assertThat(cancelFilled.notCanceled()).containsEntry(buyId, "order already matched");
    }

    @Test
    void fillsCanBeDisabled() {
        paper = new PaperExchangeClient(marketData, Clock.fixed(NOW, ZoneOffset.UTC), false, new BigDecimal("5"));
        paper.submitOrder(OrderSpec.limit(INSTRUMENT, OrderSide.SELL, new BigDecimal("0.40"), BigDecimal.TEN, 0));

        paper.listOpenOrders("m1", "t1");

        assertThat(paper.listTrades(TradeFilter.forMaker(PaperExchangeClient.PAPER_ACCOUNT))).isEmpty();
        assertThat(paper.listOwnOpenOrders(null, null)).hasSize(1);
    }

    @Test
    void cancelRemovesRestingOrder() {
        String id = paper.submitOrder(OrderSpec.limit(INSTRUMENT, OrderSide.SELL, new BigDecimal("0.60"), BigDecimal.TEN, 0)).orderId();

        assertThat(paper.cancelOrder(id).isCanceled(id)).isTrue();
        assertThat(paper.listOwnOpenOrders("m1", "t1")).isEmpty();
        assertThat(paper.cancelOrder("paper-unknown").notCanceled()).containsEntry("paper-unknown", "order not found");
    }

    @Test
    void minOrderSizeFallsBackToDefault() {
        marketData.minOrderSize = new BigDecimal("15");
        assertThat(paper.getMinOrderSize("m1")).isEqualByComparingTo("15");

        marketData.failMinOrderSize = true;
        assertThat(paper.getMinOrderSize("m1")).isEqualByComparingTo("5");
    }
}
