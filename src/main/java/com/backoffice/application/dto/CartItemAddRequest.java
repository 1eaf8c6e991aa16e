package com.backoffice.application.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CartItemAddRequest(
    @NotNull(message = "상품 ID는 필수입니다")
    Long productId,

    @NotNull(message = "수량은 필수입니다")
    @Positive(message = "수량은 1개 이상이어야 합니다")
    Integer quantity
) {}
