package io.clientportal.sdk.market;

import java.util.List;

public record OrderBook(long conid, List<BookEntry> bids, List<BookEntry> asks, Long timestamp) {

    public OrderBook {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }
}
