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
import java.util.Set;
import java.util.logging.Logger;

/**
 * Resolves ticker symbols to gateway contract ids.
 */
public final class ContractAdapter {

    private static final Logger LOGGER = Logger.getLogger(ContractAdapter.class.getName());
    private static final Set<String> PREFERRED_EXCHANGES = Set.of("NASDAQ", "SMART");

    private final SessionGuard session;
    private final GatewayTransport transport;

    public ContractAdapter(SessionGuard session, GatewayTransport transport) {
        this.session = Objects.requireNonNull(session, "session");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public Contract search(String symbol) throws ClientPortalException {
        return search(symbol, "STK");
    }

    /**
     * Searches {@code /iserver/secdef/search} and picks the best match: the first contract listed on NASDAQ or SMART,
     * otherwise the first contract returned.
     *
     * @throws ClientPortalException when the gateway returns no usable contract.
     */
    public Contract search(String symbol, String secType) throws ClientPortalException {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        session.ensureLive();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", normalized);
        params.put("secType", secType == null || secType.isBlank() ? "STK" : secType);
        JsonNode data = transport.get("/iserver/secdef/search", params);

        if (!data.isArray()) {
            throw new ClientPortalException("No contract found for symbol " + normalized);
        }

        List<Contract> candidates = new ArrayList<>();
        for (JsonNode node : data) {
            Long conid = node.isObject() ? Numbers.integer(node.get("conid")) : null;
            if (conid == null) {
                continue;
            }
            candidates.add(new Contract(
                conid,
                Json.text(node, "symbol", normalized),
                Json.text(node, "exchange", Json.text(node, "description", "UNKNOWN")),
                Json.text(node, "companyName", null)
            ));
        }
        if (candidates.isEmpty()) {
            throw new ClientPortalException("No contract found for symbol " + normalized);
        }

        Contract best = candidates.stream()
            .filter(c -> PREFERRED_EXCHANGES.contains(c.exchange().toUpperCase(Locale.ROOT)))
            .findFirst()
            .orElse(candidates.get(0));
        LOGGER.info(() -> "[clientportal-sdk] resolved " + normalized + " to conid " + best.conid() + " on " + best.exchange());
        return best;
    }
}
