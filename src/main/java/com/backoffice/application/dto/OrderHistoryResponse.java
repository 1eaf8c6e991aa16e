package com.backoffice.application.dto;

import com.backoffice.domain.entity.Order;
import com.backoffice.domain.entity.OrderStatus;
import com.backoffice.domain.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderHistoryResponse(
    Long orderId,
    String orderNumber,
    BigDecimal totalAmount,
    BigDecimal discountAmount,
    BigDecimal finalAmount,
    OrderStatus status,
    PaymentStatus paymentStatus,
    LocalDateTime createdAt,
    List<OrderItemResponse> items
) {

    public static OrderHistoryResponse of(Order order, List<OrderItemResponse> items) {
        return new OrderHistoryResponse(
            order.getId(),
            order.getOrderNumber(),
            order.getTotalAmount(),
            order.getDiscountAmount(),
            order.getFinalAmount(),
            order.getStatus(),
            order.getPaymentStatus(),
            order.getCreatedAt(),
            items
        );
    }
}
