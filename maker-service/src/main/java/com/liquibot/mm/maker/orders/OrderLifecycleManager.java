package com.liquibot.mm.maker.orders;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.events.MakerEventPublisher;
import com.liquibot.mm.events.MakerEventTypes;
import com.liquibot.mm.exchange.CancelOrderResponse;
import com.liquibot.mm.exchange.ExchangeClient;
import com.liquibot.mm.exchange.OpenOrder;
import com.liquibot.mm.exchange.OrderSpec;
import com.liquibot.mm.exchange.SubmitOrderResponse;
import com.liquibot.mm.maker.metrics.MakerMetrics;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Authoritative registry of the orders this process placed, per instrument.
 *
 * <p>Every exchange failure comes back as a result object; nothing here throws for a failed call. Each
 * instrument has its own slice and lock, so loops quoting different instruments never contend. Locks are not
 * held while an exchange call is in flight.
 */
@Slf4j
public class OrderLifecycleManager {

    private static final int MAX_TERMINAL_ORDERS_PER_INSTRUMENT = 200;

    private final ExchangeClient exchange;
    private final BigDecimal minPrice;
    private final BigDecimal maxPrice;
    private final Clock clock;
    private final MakerEventPublisher events;
    private final MakerMetrics metrics;

    private final ConcurrentMap<Instrument, Slice> slices = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instrument> instrumentByOrderId = new ConcurrentHashMap<>();

    public OrderLifecycleManager(
            ExchangeClient exchange,
            BigDecimal minPrice,
            BigDecimal maxPrice,
            Clock clock,
            MakerEventPublisher events,
            MakerMetrics metrics
    ) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.minPrice = Objects.requireNonNull(minPrice, "minPrice");
        this.maxPrice = Objects.requireNonNull(maxPrice, "maxPrice");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = Objects.requireNonNull(events, "events");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public OrderResult place(Instrument instrument, OrderSide side, BigDecimal size, BigDecimal price, int feeRateBps) {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(side, "side");

        BigDecimal clampedPrice = clampPrice(price);
        BigDecimal minSize;
        try {
            minSize = exchange.getMinOrderSize(instrument.marketId());
        } catch (RuntimeException e) {
            log.warn("min order size lookup failed for {}, not placing {}: {}", instrument, side, e.getMessage());
            metrics.orderFailed();
            return OrderResult.failed(side, clampedPrice, size, "min order size unavailable: " + e.getMessage());
        }
        BigDecimal clampedSize = clampSize(size, minSize);
        if (clampedPrice.compareTo(price == null ? BigDecimal.ZERO : price) != 0
                || clampedSize.compareTo(size == null ? BigDecimal.ZERO : size) != 0) {
            log.debug("clamped {} {} order {}@{} -> {}@{}", instrument, side, size, price, clampedSize, clampedPrice);
        }

        Instant now = clock.instant();
        String pendingKey = UUID.randomUUID().toString();
        ManagedOrder pending = new ManagedOrder(null, instrument, side, clampedSize, clampedPrice, now, OrderStatus.PENDING, now);
        Slice slice = slice(instrument);
        synchronized (slice) {
            slice.pending.put(pendingKey, pending);
        }

        String error;
        try {
            SubmitOrderResponse response = exchange.submitOrder(OrderSpec.limit(instrument, side, clampedPrice, clampedSize, feeRateBps));
            if (response != null && response.success() && response.hasOrderId()) {
                ManagedOrder live = pending.acknowledged(response.orderId(), clock.instant());
                synchronized (slice) {
                    slice.pending.remove(pendingKey);
                    slice.byId.put(live.id(), live);
                }
                instrumentByOrderId.put(live.id(), instrument);
                metrics.orderPlaced();
                events.publish(MakerEventTypes.ORDER_PLACED, live.id(), live);
                log.info("placed {} {} {}@{} id={}", instrument, side, clampedSize, clampedPrice, live.id());
                return OrderResult.placed(live);
            }
            error = response == null ? "empty response" : Optional.ofNullable(response.errorMessage()).orElse("order not accepted");
        } catch (RuntimeException e) {
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }

        // the failed record leaves the registry
        synchronized (slice) {
            slice.pending.remove(pendingKey);
        }
        ManagedOrder failed = pending.withStatus(OrderStatus.FAILED, clock.instant());
        metrics.orderFailed();
        events.publish(MakerEventTypes.ORDER_FAILED, instrument.toString(), failed);
        log.warn("failed to place {} {} {}@{}: {}", instrument, side, clampedSize, clampedPrice, error);
        return OrderResult.failed(side, clampedPrice, clampedSize, error);
    }

    public CancelResult cancel(String orderId) {
        Objects.requireNonNull(orderId, "orderId");
        Instrument instrument = instrumentByOrderId.get(orderId);
        ManagedOrder tracked = instrument == null ? null : find(orderId).orElse(null);
        if (tracked != null && tracked.status().isTerminal()) {
            return new CancelResult(orderId, tracked.status() == OrderStatus.CANCELED, tracked.status(), "already " + tracked.status());
        }

        boolean confirmed;
        String message;
        try {
            CancelOrderResponse response = exchange.cancelOrder(orderId);
            confirmed = response != null && response.isCanceled(orderId);
            message = confirmed ? null : (response == null ? "empty response" : response.reasonNotCanceled(orderId));
        } catch (RuntimeException e) {
            confirmed = false;
            message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }

        if (tracked == null) {
            log.debug("cancel of untracked order {} confirmed={}", orderId, confirmed);
            return new CancelResult(orderId, confirmed, null, message);
        }

        OrderStatus next = confirmed ? OrderStatus.CANCELED : OrderStatus.UNKNOWN;
        ManagedOrder updated = transition(instrument, orderId, next);
        if (confirmed) {
            metrics.orderCanceled();
            events.publish(MakerEventTypes.ORDER_CANCELED, orderId, updated);
            log.info("canceled {} {} id={}", instrument, tracked.side(), orderId);
        } else {
            metrics.orderUnknown();
            events.publish(MakerEventTypes.ORDER_UNKNOWN, orderId, updated);
            log.warn("cancel of {} {} id={} not confirmed, status UNKNOWN until reconciled: {}",
                    instrument, tracked.side(), orderId, message);
        }
        return new CancelResult(orderId, confirmed, next, message);
    }

    /**
     * Resolves UNKNOWN orders of {@code instrument} against the account's resting orders: present means LIVE,
     * absent means CANCELED. On failure the orders stay UNKNOWN.
     */
    public ReconcileResult reconcile(Instrument instrument) {
        List<String> unknown = unresolvedOrders(instrument).stream().map(ManagedOrder::id).toList();
        if (unknown.isEmpty()) {
            return ReconcileResult.nothingToDo();
        }

        Set<String> resting;
        try {
            List<OpenOrder> own = exchange.listOwnOpenOrders(instrument.marketId(), instrument.tokenId());
            resting = own == null ? Set.of() : own.stream()
                    .map(OpenOrder::id)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toSet());
        } catch (RuntimeException e) {
            log.warn("reconcile of {} failed, {} order(s) stay UNKNOWN: {}", instrument, unknown.size(), e.getMessage());
            return ReconcileResult.failed(unknown, e.getMessage());
        }

        List<String> live = new ArrayList<>();
        List<String> canceled = new ArrayList<>();
        for (String id : unknown) {
            OrderStatus next = resting.contains(id) ? OrderStatus.LIVE : OrderStatus.CANCELED;
            ManagedOrder updated = transition(instrument, id, next);
            (next == OrderStatus.LIVE ? live : canceled).add(id);
            events.publish(MakerEventTypes.ORDER_RECONCILED, id, updated);
        }
        log.info("reconciled {}: live={} canceled={}", instrument, live, canceled);
        return new ReconcileResult(true, live, canceled, List.of(), null);
    }

    public List<ManagedOrder> orders(Instrument instrument) {
        Slice slice = slices.get(instrument);
        if (slice == null) {
            return List.of();
        }
        synchronized (slice) {
            List<ManagedOrder> out = new ArrayList<>(slice.pending.values());
            out.addAll(slice.byId.values());
            return List.copyOf(out);
        }
    }

    public List<ManagedOrder> liveOrders(Instrument instrument) {
        return withStatus(instrument, OrderStatus.LIVE);
    }

    public List<ManagedOrder> unresolvedOrders(Instrument instrument) {
        return withStatus(instrument, OrderStatus.UNKNOWN);
    }

    public Optional<ManagedOrder> find(String orderId) {
        Instrument instrument = orderId == null ? null : instrumentByOrderId.get(orderId);
        Slice slice = instrument == null ? null : slices.get(instrument);
        if (slice == null) {
            return Optional.empty();
        }
        synchronized (slice) {
            return Optional.ofNullable(slice.byId.get(orderId));
        }
    }

    BigDecimal clampPrice(BigDecimal price) {
        if (price == null) {
            return minPrice;
        }
        return price.max(minPrice).min(maxPrice);
    }

    static BigDecimal clampSize(BigDecimal size, BigDecimal minSize) {
        BigDecimal requested = size == null ? BigDecimal.ZERO : size;
        if (minSize == null) {
            return requested;
        }
        return requested.max(minSize);
    }

    private List<ManagedOrder> withStatus(Instrument instrument, OrderStatus status) {
        Slice slice = slices.get(instrument);
        if (slice == null) {
            return List.of();
        }
        synchronized (slice) {
            return slice.byId.values().stream().filter(o -> o.status() == status).toList();
        }
    }

    private ManagedOrder transition(Instrument instrument, String orderId, OrderStatus next) {
        Slice slice = slice(instrument);
        synchronized (slice) {
            ManagedOrder current = slice.byId.get(orderId);
            if (current == null) {
                return null;
            }
            ManagedOrder updated = current.withStatus(next, clock.instant());
            slice.byId.put(orderId, updated);
            if (next.isTerminal()) {
                pruneTerminal(slice);
            }
            return updated;
        }
    }

    // oldest terminal orders go first; insertion order of byId is placement order
    private void pruneTerminal(Slice slice) {
        long terminal = slice.byId.values().stream().filter(o -> o.status().isTerminal()).count();
        Iterator<Map.Entry<String, ManagedOrder>> it = slice.byId.entrySet().iterator();
        while (terminal > MAX_TERMINAL_ORDERS_PER_INSTRUMENT && it.hasNext()) {
            Map.Entry<String, ManagedOrder> e = it.next();
            if (e.getValue().status().isTerminal()) {
                it.remove();
                instrumentByOrderId.remove(e.getKey());
                terminal--;
            }
        }
    }

    private Slice slice(Instrument instrument) {
        return slices.computeIfAbsent(instrument, k -> new Slice());
    }

    private static final class Slice {
        private final Map<String, ManagedOrder> pending = new LinkedHashMap<>();
        private final Map<String, ManagedOrder> byId = new LinkedHashMap<>();
    }
}
