package io.clientportal.sdk.market;

import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.internal.Json;
import io.clientportal.sdk.internal.Numbers;
import io.clientportal.sdk.session.SessionGuard;
import io.clientportal.sdk.transport.GatewayTransport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Snapshots, historical bars and depth of market.
 */
public final class MarketDataAdapter {

    // Gateway field tags requested by default.
    static final String FIELD_SYMBOL = "55";
    static final String FIELD_LAST = "31";
    static final String FIELD_HIGH = "70";
    static final String FIELD_LOW = "71";
    static final String FIELD_CHANGE = "82";
    static final String FIELD_CHANGE_PERCENT = "83";
    static final String FIELD_BID = "84";
    static final String FIELD_ASK_SIZE = "85";
    static final String FIELD_ASK = "86";
    static final String FIELD_VOLUME = "87";
    static final String FIELD_BID_SIZE = "88";
    static final String FIELD_OPEN = "7295";
    static final String FIELD_CLOSE = "7296";

    public static final List<String> DEFAULT_SNAPSHOT_FIELDS = List.of(
        FIELD_SYMBOL, FIELD_LAST, FIELD_BID, FIELD_ASK, FIELD_BID_SIZE, FIELD_ASK_SIZE, FIELD_VOLUME,
        FIELD_CHANGE, FIELD_CHANGE_PERCENT, FIELD_HIGH, FIELD_LOW, FIELD_OPEN, FIELD_CLOSE
    );

    private static final Logger LOGGER = Logger.getLogger(MarketDataAdapter.class.getName());

    private final SessionGuard session;
    private final GatewayTransport transport;

    public MarketDataAdapter(SessionGuard session, GatewayTransport transport) {
        this.session = Objects.requireNonNull(session, "session");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public Snapshot snapshot(long conid) throws ClientPortalException {
        return snapshot(conid, DEFAULT_SNAPSHOT_FIELDS);
    }

    /**
     * Requests a snapshot for {@code conid}. Values are read from the numeric field tags, falling back to named keys.
     *
     * @param fields field tags to request; {@link #DEFAULT_SNAPSHOT_FIELDS} when null or empty.
     * @throws ClientPortalException when the gateway returns no snapshot for the contract.
     */
    public Snapshot snapshot(long conid, List<String> fields) throws ClientPortalException {
        requireConid(conid);
        session.ensureLive();

        List<String> requested = fields == null || fields.isEmpty() ? DEFAULT_SNAPSHOT_FIELDS : fields;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("conids", conid);
        params.put("fields", String.join(",", requested));
        JsonNode data = transport.get("/iserver/marketdata/snapshot", params);

        if (!data.isArray() || data.isEmpty() || !data.get(0).isObject()) {
            throw new ClientPortalException("No snapshot data returned for conid " + conid);
        }

        JsonNode item = data.get(0);
        Snapshot snapshot = new Snapshot(
            conid,
            Json.text(item, FIELD_SYMBOL, Json.text(item, "symbol", null)),
            Numbers.decimal(Json.firstPresent(item, FIELD_LAST, "last")),
            Numbers.decimal(Json.firstPresent(item, FIELD_BID, "bid")),
            Numbers.decimal(Json.firstPresent(item, FIELD_ASK, "ask")),
            Numbers.integer(Json.firstPresent(item, FIELD_BID_SIZE, "bidSize")),
            Numbers.integer(Json.firstPresent(item, FIELD_ASK_SIZE, "askSize")),
            Numbers.integer(Json.firstPresent(item, FIELD_VOLUME, "volume")),
            Numbers.decimal(Json.firstPresent(item, FIELD_CHANGE, "change")),
            Numbers.decimal(Json.firstPresent(item, FIELD_CHANGE_PERCENT, "changePercent")),
            Numbers.decimal(Json.firstPresent(item, FIELD_HIGH, "high")),
            Numbers.decimal(Json.firstPresent(item, FIELD_LOW, "low")),
            Numbers.decimal(Json.firstPresent(item, FIELD_OPEN, "open")),
            Numbers.decimal(Json.firstPresent(item, FIELD_CLOSE, "77", "close")),
            Json.text(item, "server_id", null),
            Numbers.integer(item.get("_updated"))
        );
        LOGGER.info(() -> "[clientportal-sdk] snapshot for conid " + conid + ": last=" + snapshot.lastPrice());
        return snapshot;
    }

    /**
     * Returns historical bars.
     *
     * @param bar        bar size, for example {@code 1d} or {@code 5min}.
     * @param period     look-back period, for example {@code 1m} or {@code 1y}.
     * @param outsideRth include data outside regular trading hours.
     */
    public List<Bar> history(long conid, String bar, String period, boolean outsideRth) throws ClientPortalException {
        requireConid(conid);
        session.ensureLive();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("conid", conid);
        params.put("bar", bar == null || bar.isBlank() ? "1d" : bar);
        params.put("period", period == null || period.isBlank() ? "1m" : period);
        params.put("outsideRth", outsideRth);
        JsonNode data = transport.get("/iserver/marketdata/history", params);

        List<Bar> bars = new ArrayList<>();
        for (JsonNode node : data.path("data")) {
            Long timestamp = Numbers.integer(node.get("t"));
            if (timestamp == null) {
                LOGGER.warning(() -> "[clientportal-sdk] skipping bar without timestamp: " + node);
                continue;
            }
            bars.add(new Bar(
                timestamp,
                Numbers.decimal(node.get("o")),
                Numbers.decimal(node.get("h")),
                Numbers.decimal(node.get("l")),
                Numbers.decimal(node.get("c")),
                Numbers.decimal(node.get("v"))
            ));
        }
        LOGGER.info(() -> String.format(Locale.ROOT, "[clientportal-sdk] got %d bars for conid %d", bars.size(), conid));
        return bars;
    }

    public List<Bar> history(long conid) throws ClientPortalException {
        return history(conid, "1d", "1m", true);
    }

    /**
     * Returns depth of market for {@code conid}, optionally restricted to one exchange.
     */
    public OrderBook book(long conid, String exchange) throws ClientPortalException {
        requireConid(conid);
        session.ensureLive();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("conid", conid);
        if (exchange != null && !exchange.isBlank()) {
            params.put("exchange", exchange);
        }
        JsonNode data = transport.get("/iserver/marketdata/book", params);

        OrderBook book = new OrderBook(
            conid,
            bookSide(data.path("bids")),
            bookSide(data.path("asks")),
            Numbers.integer(data.get("timestamp"))
        );
        LOGGER.info(() -> String.format(Locale.ROOT, "[clientportal-sdk] order book for conid %d: %d bids, %d asks",
            conid, book.bids().size(), book.asks().size()));
        return book;
    }

    private static List<BookEntry> bookSide(JsonNode side) {
        List<BookEntry> entries = new ArrayList<>();
        for (JsonNode node : side) {
            if (!node.isObject()) {
                continue;
            }
            entries.add(new BookEntry(
                Numbers.decimal(node.get("price")),
                Numbers.integer(node.get("size")),
                Json.text(node, "exchange", null)
            ));
        }
        return entries;
    }

    static void requireConid(long conid) {
        if (conid <= 0) {
            throw new IllegalArgumentException("conid must be positive");
        }
    }
}
