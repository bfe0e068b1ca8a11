package io.clientportal.sdk.portfolio;

import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.internal.Json;
import io.clientportal.sdk.session.SessionGuard;
import io.clientportal.sdk.transport.GatewayTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Lists the brokerage accounts visible to the session.
 */
public final class AccountsAdapter {

    private static final Logger LOGGER = Logger.getLogger(AccountsAdapter.class.getName());

    private final SessionGuard session;
    private final GatewayTransport transport;

    public AccountsAdapter(SessionGuard session, GatewayTransport transport) {
        this.session = Objects.requireNonNull(session, "session");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns the accounts from {@code /portfolio/accounts}. The gateway answers either with account objects or, for
     * some account structures, with bare account ids.
     */
    public List<Account> accounts() throws ClientPortalException {
        session.ensureLive();
        JsonNode data = transport.get("/portfolio/accounts");

        List<Account> results = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                if (node.isObject()) {
                    String id = Json.text(node, "id", Json.text(node, "accountId", ""));
                    if (id.isBlank()) {
                        LOGGER.warning(() -> "[clientportal-sdk] skipping account without id: " + node);
                        continue;
                    }
                    results.add(new Account(
                        id,
                        Json.text(node, "type", Json.text(node, "accountVan", "")),
                        Json.text(node, "desc", ""),
                        node.path("covestor").asBoolean(false)
                    ));
                } else if (node.isValueNode() && !node.asText().isBlank()) {
                    results.add(new Account(node.asText(), "UNKNOWN", "", false));
                }
            }
        }
        LOGGER.info(() -> String.format(Locale.ROOT, "[clientportal-sdk] found %d accounts", results.size()));
        return results;
    }

    public Map<String, Object> accountSummary(String accountId) throws ClientPortalException {
        requireAccount(accountId);
        session.ensureLive();
        JsonNode data = transport.get("/portfolio/" + accountId + "/summary");
        LOGGER.fine(() -> "[clientportal-sdk] account " + accountId + " summary: " + data);
        return Json.toMap(data);
    }

    static void requireAccount(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required");
        }
    }
}
