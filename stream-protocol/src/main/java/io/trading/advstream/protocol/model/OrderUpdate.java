package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Order state change for the authenticated user.
 */
public record OrderUpdate(
    @JsonProperty("order_id") String orderId,
    @JsonProperty("client_order_id") String clientOrderId,
    @JsonProperty("cumulative_quantity") BigDecimal cumulativeQuantity,
    @JsonProperty("leaves_quantity") BigDecimal leavesQuantity,
    @JsonProperty("avg_price") BigDecimal avgPrice,
    @JsonProperty("total_fees") BigDecimal totalFees,
    @JsonProperty("status") String status,
    @JsonProperty("product_id") String productId,
    @JsonProperty("creation_time") String creationTime,
    @JsonProperty("order_side") Side orderSide,
    @JsonProperty("order_type") String orderType
) {
}
