package com.backoffice.application.event;

import java.math.BigDecimal;

/**
 * 주문 생성 이벤트 (트랜잭션 커밋 후 처리)
 */
public record OrderCreatedEvent(
        Long orderId,
        String orderNumber,
        Long userId,
        BigDecimal finalAmount,
        Long couponId,
        int itemCount
) {
}
