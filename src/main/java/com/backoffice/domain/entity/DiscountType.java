package com.backoffice.domain.entity;

/**
 * 할인 타입
 */
public enum DiscountType {
    PERCENTAGE,      // 비율 할인 (%)
    FIXED_AMOUNT     // 고정 금액 할인
}
