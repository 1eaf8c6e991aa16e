package com.backoffice.application.dto;

import com.backoffice.domain.entity.Order;
import com.backoffice.domain.entity.OrderStatus;
import com.backoffice.domain.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record OrderResponse(
    Long orderId,
    String orderNumber,
    Long userId,
    BigDecimal totalAmount,
    BigDecimal discountAmount,
    BigDecimal finalAmount,
    Long couponId,
    OrderStatus status,
    PaymentStatus paymentStatus,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static OrderResponse from(Order order) {
        return new OrderResponse(
            order.getId(),
            order.getOrderNumber(),
            order.getUserId(),
            order.getTotalAmount(),
            order.getDiscountAmount(),
            order.getFinalAmount(),
            order.getCouponId(),
            order.getStatus(),
            order.getPaymentStatus(),
            order.getCreatedAt(),
            order.getUpdatedAt()
        );
    }
}
