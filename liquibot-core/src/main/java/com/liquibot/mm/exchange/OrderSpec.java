package com.liquibot.mm.exchange;

import com.liquibot.mm.domain.ClobOrderType;
import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;

import java.math.BigDecimal;
import java.util.Objects;

public record OrderSpec(
    Instrument instrument,
    OrderSide side,
    BigDecimal price,
    BigDecimal size,
    int feeRateBps,
    ClobOrderType orderType
) {
  public OrderSpec {
    Objects.requireNonNull(instrument, "instrument");
    Objects.requireNonNull(side, "side");
    Objects.requireNonNull(price, "price");
    Objects.requireNonNull(size, "size");
    if (orderType == null) {
      orderType = ClobOrderType.GTC;
    }
  }

  public static OrderSpec limit(Instrument instrument, OrderSide side, BigDecimal price, BigDecimal size, int feeRateBps) {
    return new OrderSpec(instrument, side, price, size, feeRateBps, ClobOrderType.GTC);
  }
}
