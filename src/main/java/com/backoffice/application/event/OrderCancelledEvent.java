package com.backoffice.application.event;

/**
 * 주문 취소 이벤트 (트랜잭션 커밋 후 처리)
 *
 * @param restoredItemCount 재고 복구 대상이 된 주문 항목 수
 */
public record OrderCancelledEvent(
        Long orderId,
        String orderNumber,
        Long userId,
        int restoredItemCount
) {
}
