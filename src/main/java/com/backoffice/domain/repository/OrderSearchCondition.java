package com.backoffice.domain.repository;

import com.backoffice.domain.entity.OrderStatus;
import com.backoffice.domain.entity.PaymentStatus;

/**
 * 주문 목록 조회 조건. null인 필드는 조건에서 제외되며 최신 주문부터 정렬됩니다.
 */
public record OrderSearchCondition(
        Long userId,
        OrderStatus status,
        PaymentStatus paymentStatus,
        int limit,
        int offset
) {
}
