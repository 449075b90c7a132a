package com.liquibot.mm.maker.pricing;

import java.math.BigDecimal;

/**
 * Mid-price of one instrument and where it came from. {@code bestBid}/{@code bestAsk} are null unless the book was read.
 */
public record MidPriceQuote(BigDecimal price, BigDecimal bestBid, BigDecimal bestAsk, Source source) {

    public enum Source {
        /**
         * At least one side of the book had orders.
         */
        BOOK,
        /**
         * The book was read but had no orders on either side.
         */
        EMPTY_BOOK,
        /**
         * The book could not be read.
         */
        FETCH_FAILED,
    }

    public boolean isFallback() {
        return source != Source.BOOK;
    }
}
