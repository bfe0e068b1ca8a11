package io.clientportal.sdk.trading;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OrderRequestTest {

    @Test
    void defaultsToAdaptiveDayMarketOrder() {
        OrderRequest order = OrderRequest.builder()
            .conid(265598)
            .side(OrderSide.BUY)
            .quantity(10)
            .build();

        assertEquals(OrderType.MARKET, order.getOrderType());
        assertEquals(TimeInForce.DAY, order.getTimeInForce());
        assertTrue(order.isUseAdaptive());
        assertFalse(order.isOutsideRth());
        assertNull(order.getPrice());
    }

    @Test
    void limitOrdersRequirePrice() {
        OrderRequest.Builder builder = OrderRequest.builder()
            .conid(265598)
            .side(OrderSide.SELL)
            .quantity(5)
            .orderType(OrderType.LIMIT);

        assertThrows(IllegalArgumentException.class, builder::build);
        assertNotNull(builder.price(new BigDecimal("190.50")).build());
    }

    @Test
    void stopLimitOrdersRequireBothPrices() {
        OrderRequest.Builder builder = OrderRequest.builder()
            .conid(265598)
            .side(OrderSide.SELL)
            .quantity(5)
            .orderType(OrderType.STOP_LIMIT)
            .price(new BigDecimal("180"));

        assertThrows(IllegalArgumentException.class, builder::build);
        assertNotNull(builder.auxPrice(new BigDecimal("181")).build());
    }

    @Test
    void rejectsMissingSideAndNonPositiveQuantity() {
        assertThrows(IllegalArgumentException.class,
            () -> OrderRequest.builder().conid(1).quantity(1).build());
        assertThrows(IllegalArgumentException.class,
            () -> OrderRequest.builder().conid(1).side(OrderSide.BUY).quantity(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> OrderRequest.builder().side(OrderSide.BUY).quantity(1).build());
    }

    @Test
    void mapsGatewayCodes() {
        assertEquals("STP_LMT", OrderType.STOP_LIMIT.code());
        assertEquals(OrderType.LIMIT, OrderType.fromCode("lmt"));
        assertEquals(OrderStatus.PRE_SUBMITTED, OrderStatus.fromCode("PreSubmitted").orElseThrow());
        assertTrue(OrderStatus.fromCode("Inactive").isEmpty());
    }
}
