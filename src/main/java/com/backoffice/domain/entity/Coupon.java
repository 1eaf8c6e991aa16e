package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import com.backoffice.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 쿠폰 Entity
 * 코드 기반 할인 쿠폰으로, 사용 횟수/만료일/최소 주문 금액 제약을 가집니다.
 *
 * usedCount는 단조 증가하며, usageLimit이 있으면 usedCount ≤ usageLimit을 유지합니다.
 */
@Entity
@Table(name = "coupons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Coupon extends BaseTimeEntity {

    private static final BigDecimal MAX_PERCENTAGE = BigDecimal.valueOf(100);

    @Column(name = "code", nullable = false, unique = true, length = 50)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private DiscountType discountType;

    @Column(name = "value", nullable = false, precision = 10, scale = 2)
    private BigDecimal value;

    @Column(name = "minimum_order_amount", precision = 10, scale = 2)
    private Money minimumOrderAmount;

    @Column(name = "usage_limit")
    private Integer usageLimit;

    @Column(name = "used_count", nullable = false)
    private int usedCount;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    public Coupon(String code, DiscountType discountType, BigDecimal value,
                  BigDecimal minimumOrderAmount, Integer usageLimit, LocalDateTime expiresAt) {
        validateConstructorParams(code, discountType, value, minimumOrderAmount);
        validateUsageLimit(usageLimit);

        this.code = code;
        this.discountType = discountType;
        this.value = value;
        this.minimumOrderAmount = minimumOrderAmount != null ? Money.of(minimumOrderAmount) : null;
        this.usageLimit = usageLimit;
        this.usedCount = 0;
        this.active = true;
        this.expiresAt = expiresAt;
        initializeTimestamps();
    }

    private void validateConstructorParams(String code, DiscountType discountType,
                                           BigDecimal value, BigDecimal minimumOrderAmount) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("쿠폰 코드는 필수입니다");
        }
        if (discountType == null) {
            throw new IllegalArgumentException("할인 타입은 필수입니다");
        }
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException("할인 값은 0보다 커야 합니다");
        }
        if (discountType == DiscountType.PERCENTAGE && value.compareTo(MAX_PERCENTAGE) > 0) {
            throw new IllegalArgumentException("비율 할인은 100% 이하여야 합니다");
        }
        if (minimumOrderAmount != null && minimumOrderAmount.signum() <= 0) {
            throw new IllegalArgumentException("최소 주문 금액은 0보다 커야 합니다");
        }
    }

    private void validateUsageLimit(Integer usageLimit) {
        if (usageLimit != null && usageLimit <= 0) {
            throw new IllegalArgumentException("사용 한도는 1 이상이어야 합니다");
        }
    }

    public BigDecimal getMinimumOrderAmount() {
        return minimumOrderAmount != null ? minimumOrderAmount.getAmount() : null;
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean isExhausted() {
        return usageLimit != null && usedCount >= usageLimit;
    }

    public boolean isBelowMinimum(Money orderAmount) {
        return minimumOrderAmount != null && orderAmount.isLessThan(minimumOrderAmount);
    }

    /**
     * 주문 금액에 대한 할인 금액을 계산합니다.
     * 할인 금액은 주문 금액을 넘지 않습니다.
     */
    public Money calculateDiscount(Money orderAmount) {
        Money discount = switch (discountType) {
            case PERCENTAGE -> orderAmount.percentage(value);
            case FIXED_AMOUNT -> Money.of(value);
        };
        return discount.min(orderAmount);
    }

    /**
     * 쿠폰 사용 횟수를 1 증가시킵니다.
     * 락을 잡은 상태에서 호출되어야 한도 초과가 발생하지 않습니다.
     */
    public void redeem() {
        if (!active) {
            throw new IllegalStateException("비활성화된 쿠폰은 사용할 수 없습니다");
        }
        if (isExhausted()) {
            throw new IllegalStateException("쿠폰 사용 한도를 초과했습니다");
        }
        this.usedCount++;
        touch();
    }

    public void changeActive(boolean active) {
        this.active = active;
        touch();
    }

    /**
     * 사용 한도를 변경합니다. null이면 무제한입니다.
     */
    public void changeUsageLimit(Integer usageLimit) {
        validateUsageLimit(usageLimit);
        this.usageLimit = usageLimit;
        touch();
    }

    /**
     * 만료 일시를 변경합니다. null이면 만료되지 않습니다.
     */
    public void changeExpiresAt(LocalDateTime expiresAt) {
        this.expiresAt = expiresAt;
        touch();
    }
}
