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
 * Positions, balances and ledger of an account.
 */
public final class PortfolioAdapter {

    static final int MAX_POSITION_PAGES = 100;

    private static final Logger LOGGER = Logger.getLogger(PortfolioAdapter.class.getName());

    private final SessionGuard session;
    private final GatewayTransport transport;

    public PortfolioAdapter(SessionGuard session, GatewayTransport transport) {
        this.session = Objects.requireNonNull(session, "session");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns one page of positions. Entries without a contract id or position size are skipped.
     */
    public List<Position> positions(String accountId, int page) throws ClientPortalException {
        AccountsAdapter.requireAccount(accountId);
        if (page < 0) {
            throw new IllegalArgumentException("page cannot be negative");
        }
        session.ensureLive();
        JsonNode data = transport.get("/portfolio/" + accountId + "/positions/" + page);

        List<Position> results = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                Position position = toPosition(accountId, node);
                if (position == null) {
                    LOGGER.warning(() -> "[clientportal-sdk] skipping unparseable position: " + node);
                    continue;
                }
                results.add(position);
            }
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[clientportal-sdk] found %d positions for account %s (page %d)", results.size(), accountId, page));
        return results;
    }

    /**
     * Walks the position pages until the gateway returns an empty page, stopping after {@value #MAX_POSITION_PAGES} pages.
     */
    public List<Position> allPositions(String accountId) throws ClientPortalException {
        List<Position> all = new ArrayList<>();
        for (int page = 0; page < MAX_POSITION_PAGES; page++) {
            List<Position> batch = positions(accountId, page);
            if (batch.isEmpty()) {
                return all;
            }
            all.addAll(batch);
        }
        LOGGER.warning(() -> String.format(Locale.ROOT,
            "[clientportal-sdk] stopped fetching positions after %d pages for account %s", MAX_POSITION_PAGES, accountId));
        return all;
    }

    public AccountSummary summary(String accountId) throws ClientPortalException {
        AccountsAdapter.requireAccount(accountId);
        session.ensureLive();
        JsonNode data = transport.get("/portfolio/" + accountId + "/summary");
        LOGGER.fine(() -> "[clientportal-sdk] summary for " + accountId + ": " + data);

        return new AccountSummary(
            unwrapText(data.get("accountcode")),
            unwrapText(data.get("accountready")),
            unwrapText(data.get("accounttype")),
            Numbers.decimal(data.get("netliquidation")),
            Numbers.decimal(data.get("availablefunds")),
            Numbers.decimal(data.get("buyingpower")),
            Numbers.decimal(data.get("excessliquidity")),
            Numbers.decimal(data.get("totalcashvalue")),
            Numbers.decimal(data.get("grosspositionvalue")),
            Numbers.decimal(data.get("equitywithloanvalue")),
            Numbers.decimal(data.get("initmarginreq")),
            Numbers.decimal(data.get("maintmarginreq")),
            Numbers.decimal(data.get("accruedcash")),
            Numbers.decimal(data.get("cushion")),
            Numbers.smallInteger(data.get("daytradesremaining")),
            unwrapBoolean(data.get("nlvandmargininreview")),
            Json.toMap(data)
        );
    }

    /**
     * Returns the ledger lines. The gateway keys the ledger by currency ({@code {"USD": {...}, "BASE": {...}}}); a single
     * line object or a list of lines is accepted as well.
     */
    public List<LedgerLine> ledger(String accountId) throws ClientPortalException {
        AccountsAdapter.requireAccount(accountId);
        session.ensureLive();
        JsonNode data = transport.get("/portfolio/" + accountId + "/ledger");

        List<LedgerLine> lines = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                if (node.isObject()) {
                    lines.add(toLedgerLine(null, node));
                }
            }
        } else if (data.isObject()) {
            if (data.has("cashbalance") || data.has("currency")) {
                lines.add(toLedgerLine(null, data));
            } else {
                Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    if (entry.getValue().isObject()) {
                        lines.add(toLedgerLine(entry.getKey(), entry.getValue()));
                    }
                }
            }
        }
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[clientportal-sdk] found %d ledger lines for account %s", lines.size(), accountId));
        return lines;
    }

    private static Position toPosition(String accountId, JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        Long conid = Numbers.integer(node.get("conid"));
        BigDecimal size = Numbers.decimal(node.get("position"));
        if (conid == null || size == null) {
            return null;
        }
        return new Position(
            Json.text(node, "acctId", accountId),
            conid,
            Json.text(node, "contractDesc", ""),
            size,
            Numbers.decimal(node.get("mktPrice")),
            Numbers.decimal(node.get("mktValue")),
            Json.text(node, "currency", "USD"),
            Numbers.decimal(node.get("avgCost")),
            Numbers.decimal(node.get("avgPrice")),
            Numbers.decimal(node.get("realizedPnl")),
            Numbers.decimal(node.get("unrealizedPnl")),
            Json.text(node, "assetClass", null),
            Json.text(node, "expiry", null),
            Json.text(node, "putOrCall", null),
            Numbers.decimal(node.get("strike")),
            Numbers.decimal(node.get("multiplier")),
            Numbers.integer(node.get("undConid"))
        );
    }

    private static LedgerLine toLedgerLine(String key, JsonNode node) {
        String currency = Json.text(node, "currency", key);
        return new LedgerLine(
            currency,
            Json.text(node, "acctcode", null),
            Numbers.decimal(node.get("cashbalance")),
            Numbers.decimal(node.get("settledcash")),
            Numbers.decimal(node.get("netliquidationvalue")),
            Numbers.decimal(node.get("stockmarketvalue")),
            Numbers.decimal(node.get("unrealizedpnl")),
            Numbers.decimal(node.get("realizedpnl")),
            Numbers.decimal(node.get("exchangerate")),
            Numbers.decimal(node.get("interest")),
            Numbers.decimal(node.get("dividends")),
            Numbers.integer(node.get("timestamp"))
        );
    }

    // Summary fields arrive as {"value": "...", ...} wrappers.
    private static String unwrapText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            return Json.text(node, "value", null);
        }
        return node.asText();
    }

    private static Boolean unwrapBoolean(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.isObject() ? node.get("value") : node;
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return "true".equalsIgnoreCase(value.asText().trim());
    }
}
