package io.clientportal.sdk.trading;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.internal.Json;
import io.clientportal.sdk.internal.Numbers;
import io.clientportal.sdk.session.SessionGuard;
import io.clientportal.sdk.transport.GatewayTransport;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Order preview, placement and management.
 * </p>
 *
 * <p>
 * {@link #placeOrder(String, OrderRequest, boolean)} runs a what-if preview first unless told otherwise: a preview error
 * aborts with {@link OrderRejectedException} before anything is sent, a preview warning is logged and the order proceeds.
 * </p>
 */
public final class OrderAdapter {

    private static final Logger LOGGER = Logger.getLogger(OrderAdapter.class.getName());

    private final SessionGuard session;
    private final GatewayTransport transport;

    public OrderAdapter(SessionGuard session, GatewayTransport transport) {
        this.session = Objects.requireNonNull(session, "session");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public WhatIfResult whatIf(String accountId, OrderRequest order) throws ClientPortalException {
        requireAccount(accountId);
        Objects.requireNonNull(order, "order");
        session.ensureLive();

        JsonNode data = transport.post("/iserver/account/" + accountId + "/orders/whatif", new OrdersPayload(List.of(payload(order))));
        LOGGER.fine(() -> "[clientportal-sdk] what-if result for " + accountId + ": " + data);

        JsonNode result = data.isArray() ? data.path(0) : data;
        if (!result.isObject()) {
            return new WhatIfResult(null, null, null, null, null);
        }
        return new WhatIfResult(
            afterValue(result.get("equity")),
            afterValue(result.get("initial")),
            afterValue(result.get("maintenance")),
            Json.text(result, "warn", null),
            Json.text(result, "error", null)
        );
    }

    public OrderResult placeOrder(String accountId, OrderRequest order) throws ClientPortalException {
        return placeOrder(accountId, order, false);
    }

    /**
     * Places an order.
     *
     * @param skipWhatIf send the order without a margin preview.
     * @throws OrderRejectedException when the preview reports an error.
     */
    public OrderResult placeOrder(String accountId, OrderRequest order, boolean skipWhatIf) throws ClientPortalException {
        requireAccount(accountId);
        Objects.requireNonNull(order, "order");
        session.ensureLive();

        if (!skipWhatIf) {
            WhatIfResult preview = whatIf(accountId, order);
            if (preview.hasError()) {
                throw new OrderRejectedException("What-if preview failed: " + preview.error());
            }
            if (preview.hasWarning()) {
                LOGGER.warning(() -> "[clientportal-sdk] what-if warning: " + preview.warning());
            }
        }

        JsonNode data = transport.post("/iserver/account/" + accountId + "/orders", new OrdersPayload(List.of(payload(order))));
        OrderResult result = toOrderResult(data);
        LOGGER.info(() -> "[clientportal-sdk] order placed for account " + accountId + ": " + result.orderId());
        return result;
    }

    public OrderResult modifyOrder(String accountId, String orderId, OrderRequest order) throws ClientPortalException {
        requireAccount(accountId);
        requireOrderId(orderId);
        Objects.requireNonNull(order, "order");
        session.ensureLive();

        JsonNode data = transport.post("/iserver/account/" + accountId + "/order/" + orderId, payload(order));
        LOGGER.info(() -> "[clientportal-sdk] order " + orderId + " modified for account " + accountId);
        return toOrderResult(data);
    }

    public Map<String, Object> cancelOrder(String accountId, String orderId) throws ClientPortalException {
        requireAccount(accountId);
        requireOrderId(orderId);
        session.ensureLive();

        JsonNode data = transport.delete("/iserver/account/" + accountId + "/order/" + orderId);
        LOGGER.info(() -> "[clientportal-sdk] order " + orderId + " cancelled for account " + accountId);
        return Json.toMap(data);
    }

    public Map<String, Object> orderStatus(String orderId) throws ClientPortalException {
        requireOrderId(orderId);
        session.ensureLive();

        JsonNode data = transport.get("/iserver/account/order/status/" + orderId);
        LOGGER.fine(() -> "[clientportal-sdk] order status for " + orderId + ": " + data);
        return Json.toMap(data);
    }

    /**
     * Returns the live orders across accounts. Entries without an order id are skipped.
     */
    public List<LiveOrder> liveOrders() throws ClientPortalException {
        session.ensureLive();
        JsonNode data = transport.get("/iserver/account/orders");

        JsonNode entries = data.isArray() ? data : data.path("orders");
        List<LiveOrder> orders = new ArrayList<>();
        for (JsonNode node : entries) {
            String orderId = node.isObject() ? Json.text(node, "orderId", null) : null;
            if (orderId == null) {
                LOGGER.warning(() -> "[clientportal-sdk] skipping live order without id: " + node);
                continue;
            }
            Long conid = Numbers.integer(node.get("conid"));
            BigDecimal quantity = Numbers.decimal(Json.firstPresent(node, "quantity", "totalSize"));
            orders.add(new LiveOrder(
                orderId,
                conid == null ? 0L : conid,
                Json.text(node, "symbol", Json.text(node, "ticker", null)),
                Json.text(node, "side", ""),
                Json.text(node, "orderType", ""),
                quantity == null ? BigDecimal.ZERO : quantity,
                Numbers.decimal(node.get("price")),
                Numbers.decimal(node.get("auxPrice")),
                Json.text(node, "status", ""),
                Numbers.decimal(Json.firstPresent(node, "filled", "filledQuantity")),
                Numbers.decimal(Json.firstPresent(node, "remaining", "remainingQuantity")),
                Numbers.decimal(node.get("avgPrice")),
                Json.text(node, "lastExecutionTime", null),
                Json.text(node, "orderRef", null),
                Json.text(node, "timeInForce", null),
                Json.text(node, "account", Json.text(node, "acct", null))
            ));
        }
        LOGGER.info(() -> String.format(Locale.ROOT, "[clientportal-sdk] found %d live orders", orders.size()));
        return orders;
    }

    private static OrderPayload payload(OrderRequest order) {
        return new OrderPayload(
            order.getConid(),
            order.getOrderType().code(),
            order.getSide().code(),
            order.getQuantity(),
            order.getTimeInForce().code(),
            order.isOutsideRth(),
            order.isUseAdaptive(),
            order.getPrice(),
            order.getAuxPrice()
        );
    }

    private static OrderResult toOrderResult(JsonNode data) {
        JsonNode first = data.isArray() ? data.path(0) : data;
        if (!first.isObject()) {
            return OrderResult.EMPTY;
        }
        return new OrderResult(
            Json.text(first, "order_id", null),
            Json.text(first, "local_order_id", null),
            Json.text(first, "order_status", null),
            Json.text(first, "encrypt_message", null)
        );
    }

    // What-if amounts arrive as {"current": ..., "change": ..., "after": ...}.
    private static BigDecimal afterValue(JsonNode node) {
        if (node != null && node.isObject() && node.has("after")) {
            return Numbers.decimal(node.get("after"));
        }
        return Numbers.decimal(node);
    }

    private static void requireAccount(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required");
        }
    }

    private static void requireOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId is required");
        }
    }

    private record OrdersPayload(List<OrderPayload> orders) {
    }

    private record OrderPayload(
        long conid,
        String orderType,
        String side,
        BigDecimal quantity,
        String tif,
        @JsonProperty("outsideRTH") boolean outsideRth,
        boolean useAdaptive,
        BigDecimal price,
        BigDecimal auxPrice
    ) {
    }
}
