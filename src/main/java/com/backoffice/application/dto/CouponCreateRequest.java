package com.backoffice.application.dto;

import com.backoffice.domain.entity.DiscountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CouponCreateRequest(
    @NotBlank(message = "쿠폰 코드는 필수입니다")
    @Size(max = 50, message = "쿠폰 코드는 50자 이하여야 합니다")
    String code,

    @NotNull(message = "할인 타입은 필수입니다")
    DiscountType type,

    @NotNull(message = "할인 값은 필수입니다")
    @Positive(message = "할인 값은 0보다 커야 합니다")
    BigDecimal value,

    @Positive(message = "최소 주문 금액은 0보다 커야 합니다")
    BigDecimal minimumOrderAmount,  // optional

    @Positive(message = "사용 한도는 1 이상이어야 합니다")
    Integer usageLimit,  // optional, null이면 무제한

    LocalDateTime expiresAt  // optional
) {}
