package com.backoffice.application.dto;

import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.entity.DiscountType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CouponResponse(
    Long couponId,
    String code,
    DiscountType type,
    BigDecimal value,
    BigDecimal minimumOrderAmount,
    Integer usageLimit,
    Integer usedCount,
    Boolean isActive,
    LocalDateTime expiresAt,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static CouponResponse from(Coupon coupon) {
        return new CouponResponse(
            coupon.getId(),
            coupon.getCode(),
            coupon.getDiscountType(),
            coupon.getValue(),
            coupon.getMinimumOrderAmount(),
            coupon.getUsageLimit(),
            coupon.getUsedCount(),
            coupon.isActive(),
            coupon.getExpiresAt(),
            coupon.getCreatedAt(),
            coupon.getUpdatedAt()
        );
    }
}
