package com.backoffice.application.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CouponValidateRequest(
    @NotBlank(message = "쿠폰 코드는 필수입니다")
    String code,

    @NotNull(message = "주문 금액은 필수입니다")
    @PositiveOrZero(message = "주문 금액은 0 이상이어야 합니다")
    BigDecimal orderAmount
) {}
