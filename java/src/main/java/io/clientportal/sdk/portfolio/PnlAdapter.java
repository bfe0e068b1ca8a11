package io.clientportal.sdk.portfolio;

import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.internal.Json;
import io.clientportal.sdk.internal.Numbers;
import io.clientportal.sdk.session.SessionGuard;
import io.clientportal.sdk.transport.GatewayTransport;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Live intraday P&amp;L.
 */
public final class PnlAdapter {

    private static final Logger LOGGER = Logger.getLogger(PnlAdapter.class.getName());

    private final SessionGuard session;
    private final GatewayTransport transport;

    public PnlAdapter(SessionGuard session, GatewayTransport transport) {
        this.session = Objects.requireNonNull(session, "session");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns {@code /iserver/account/pnl/partitioned} as rows. The gateway nests rows under {@code upnl} keyed by
     * {@code <account>.<model>}; flat single-row objects and plain lists are accepted too.
     */
    public List<PnlRow> partitionedPnl() throws ClientPortalException {
        session.ensureLive();
        JsonNode data = transport.get("/iserver/account/pnl/partitioned");
        LOGGER.fine(() -> "[clientportal-sdk] partitioned pnl: " + data);

        List<PnlRow> rows = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                if (node.isObject()) {
                    rows.add(toRow(null, node));
                }
            }
        } else if (data.path("upnl").isObject()) {
            Iterator<Map.Entry<String, JsonNode>> partitions = data.get("upnl").fields();
            while (partitions.hasNext()) {
                Map.Entry<String, JsonNode> entry = partitions.next();
                if (entry.getValue().isObject()) {
                    rows.add(toRow(entry.getKey(), entry.getValue()));
                }
            }
        } else if (data.isObject() && (data.has("dpl") || data.has("upl") || data.has("upnl"))) {
            rows.add(toRow(null, data));
        }

        LOGGER.info(() -> String.format(Locale.ROOT, "[clientportal-sdk] found %d pnl rows", rows.size()));
        return rows;
    }

    /**
     * Derives per-position P&amp;L from the first page of positions. Flat positions without any P&amp;L or value are
     * left out.
     */
    public List<PositionPnl> pnlByPosition(String accountId) throws ClientPortalException {
        AccountsAdapter.requireAccount(accountId);
        session.ensureLive();
        JsonNode data = transport.get("/portfolio/" + accountId + "/positions/0");

        JsonNode entries = data.isObject() ? data.path("positions") : data;
        List<PositionPnl> results = new ArrayList<>();
        if (entries.isArray()) {
            for (JsonNode node : entries) {
                if (!node.isObject()) {
                    continue;
                }
                Long conid = Numbers.integer(node.get("conid"));
                if (conid == null) {
                    LOGGER.warning(() -> "[clientportal-sdk] skipping position pnl without conid: " + node);
                    continue;
                }
                BigDecimal size = Numbers.decimal(node.get("position"));
                PositionPnl pnl = new PositionPnl(
                    Json.text(node, "acctId", accountId),
                    conid,
                    Json.text(node, "contractDesc", Json.text(node, "desc", "")),
                    size == null ? BigDecimal.ZERO : size,
                    Numbers.decimal(Json.firstPresent(node, "dailyPnL", "dpl")),
                    Numbers.decimal(Json.firstPresent(node, "unrealizedPnL", "upl", "unrealizedPnl")),
                    Numbers.decimal(Json.firstPresent(node, "realizedPnL", "rpl", "realizedPnl")),
                    Numbers.decimal(Json.firstPresent(node, "mktValue", "value", "marketValue"))
                );
                if (Numbers.isZeroOrNull(pnl.position())
                    && Numbers.isZeroOrNull(pnl.dailyPnl())
                    && Numbers.isZeroOrNull(pnl.unrealizedPnl())
                    && Numbers.isZeroOrNull(pnl.marketValue())) {
                    continue;
                }
                results.add(pnl);
            }
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[clientportal-sdk] found %d position pnl entries for account %s", results.size(), accountId));
        return results;
    }

    private static PnlRow toRow(String key, JsonNode node) {
        String accountId = Json.text(node, "acctId", key == null ? "" : accountFromKey(key));
        String model = Json.text(node, "model", key == null ? null : modelFromKey(key));
        return new PnlRow(
            accountId,
            model,
            Numbers.decimal(node.get("dpl")),
            Numbers.decimal(node.get("nl")),
            Numbers.decimal(Json.firstPresent(node, "upl", "upnl")),
            Numbers.decimal(node.get("el")),
            Numbers.decimal(node.get("mv"))
        );
    }

    private static String accountFromKey(String key) {
        int dot = key.indexOf('.');
        return dot < 0 ? key : key.substring(0, dot);
    }

    private static String modelFromKey(String key) {
        int dot = key.indexOf('.');
        if (dot < 0 || dot == key.length() - 1) {
            return null;
        }
        return key.substring(dot + 1);
    }
}
