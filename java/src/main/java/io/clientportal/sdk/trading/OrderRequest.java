package io.clientportal.sdk.trading;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Represents an order to preview, place or modify.
 */
public final class OrderRequest {

    private final long conid;
    private final OrderType orderType;
    private final OrderSide side;
    private final BigDecimal quantity;
    private final BigDecimal price;
    private final BigDecimal auxPrice;
    private final TimeInForce timeInForce;
    private final boolean outsideRth;
    private final boolean useAdaptive;

    private OrderRequest(Builder builder) {
        this.conid = builder.conid;
        this.orderType = builder.orderType;
        this.side = builder.side;
        this.quantity = builder.quantity;
        this.price = builder.price;
        this.auxPrice = builder.auxPrice;
        this.timeInForce = builder.timeInForce;
        this.outsideRth = builder.outsideRth;
        this.useAdaptive = builder.useAdaptive;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getConid() {
        return conid;
    }

    public OrderType getOrderType() {
        return orderType;
    }

    public OrderSide getSide() {
        return side;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    /**
     * @return limit price; required for {@link OrderType#LIMIT} and {@link OrderType#STOP_LIMIT}.
     */
    public BigDecimal getPrice() {
        return price;
    }

    /**
     * @return stop trigger price; required for {@link OrderType#STOP} and {@link OrderType#STOP_LIMIT}.
     */
    public BigDecimal getAuxPrice() {
        return auxPrice;
    }

    public TimeInForce getTimeInForce() {
        return timeInForce;
    }

    public boolean isOutsideRth() {
        return outsideRth;
    }

    public boolean isUseAdaptive() {
        return useAdaptive;
    }

    public static final class Builder {
        private long conid;
        private OrderType orderType = OrderType.MARKET;
        private OrderSide side;
        private BigDecimal quantity;
        private BigDecimal price;
        private BigDecimal auxPrice;
        private TimeInForce timeInForce = TimeInForce.DAY;
        private boolean outsideRth;
        private boolean useAdaptive = true;

        public Builder conid(long conid) {
            this.conid = conid;
            return this;
        }

        public Builder orderType(OrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder side(OrderSide side) {
            this.side = side;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder quantity(long quantity) {
            return quantity(BigDecimal.valueOf(quantity));
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder auxPrice(BigDecimal auxPrice) {
            this.auxPrice = auxPrice;
            return this;
        }

        public Builder timeInForce(TimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder outsideRth(boolean outsideRth) {
            this.outsideRth = outsideRth;
            return this;
        }

        public Builder useAdaptive(boolean useAdaptive) {
            this.useAdaptive = useAdaptive;
            return this;
        }

        /**
         * @throws IllegalArgumentException when a required field is missing or inconsistent with the order type.
         */
        public OrderRequest build() {
            if (conid <= 0) {
                throw new IllegalArgumentException("conid must be positive");
            }
            Objects.requireNonNull(orderType, "orderType");
            Objects.requireNonNull(timeInForce, "timeInForce");
            if (side == null) {
                throw new IllegalArgumentException("side is required");
            }
            if (quantity == null || quantity.signum() <= 0) {
                throw new IllegalArgumentException("quantity must be positive");
            }
            if (orderType.requiresPrice() && price == null) {
                throw new IllegalArgumentException(orderType.code() + " orders require a price");
            }
            if (orderType.requiresAuxPrice() && auxPrice == null) {
                throw new IllegalArgumentException(orderType.code() + " orders require an auxPrice");
            }
            return new OrderRequest(this);
        }
    }
}
