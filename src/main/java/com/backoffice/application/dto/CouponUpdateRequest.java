package com.backoffice.application.dto;

import jakarta.validation.constraints.Positive;

import java.time.LocalDateTime;

/**
 * 전달된(null이 아닌) 필드만 변경합니다.
 */
public record CouponUpdateRequest(
    Boolean isActive,

    @Positive(message = "사용 한도는 1 이상이어야 합니다")
    Integer usageLimit,

    LocalDateTime expiresAt
) {}
