package com.backoffice.domain.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 주문 상태
 *
 * 상태 전이 규칙:
 * PENDING → PROCESSING → COMPLETED → REFUNDED
 * PENDING → COMPLETED
 * PENDING, PROCESSING → CANCELLED (취소 전용 경로에서 재고 복구와 함께 처리)
 *
 * CANCELLED, REFUNDED는 종료 상태입니다.
 */
public enum OrderStatus {
    PENDING,       // 주문 생성, 처리 대기
    PROCESSING,    // 처리 중
    COMPLETED,     // 완료
    CANCELLED,     // 취소
    REFUNDED;      // 환불

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(PROCESSING, COMPLETED, CANCELLED));
        TRANSITIONS.put(PROCESSING, EnumSet.of(COMPLETED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(REFUNDED));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(REFUNDED, EnumSet.noneOf(OrderStatus.class));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<OrderStatus> nextStatuses() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isCancellable() {
        return canTransitionTo(CANCELLED);
    }
}
