package io.clientportal.sdk.trading;

import java.math.BigDecimal;
import java.util.Optional;

public record LiveOrder(
    String orderId,
    long conid,
    String symbol,
    String side,
    String orderType,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal auxPrice,
    String status,
    BigDecimal filled,
    BigDecimal remaining,
    BigDecimal averagePrice,
    String lastExecutionTime,
    String orderRef,
    String timeInForce,
    String account
) {

    public Optional<OrderStatus> knownStatus() {
        return OrderStatus.fromCode(status);
    }
}
