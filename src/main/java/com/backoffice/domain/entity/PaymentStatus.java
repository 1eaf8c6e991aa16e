package com.backoffice.domain.entity;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 결제 상태
 *
 * 상태 전이 규칙:
 * PENDING → COMPLETED | FAILED
 * FAILED → PENDING (재시도) | COMPLETED
 * COMPLETED → REFUNDED
 */
public enum PaymentStatus {
    PENDING,      // 결제 대기
    COMPLETED,    // 결제 완료
    FAILED,       // 결제 실패
    REFUNDED;     // 환불 완료

    private static final Map<PaymentStatus, Set<PaymentStatus>> TRANSITIONS = new EnumMap<>(PaymentStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(COMPLETED, FAILED));
        TRANSITIONS.put(FAILED, EnumSet.of(PENDING, COMPLETED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(REFUNDED));
        TRANSITIONS.put(REFUNDED, EnumSet.noneOf(PaymentStatus.class));
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }
}
