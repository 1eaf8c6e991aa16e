package com.backoffice.application.dto;

import com.backoffice.domain.entity.ProductType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record ProductCreateRequest(
    @NotBlank(message = "상품명은 필수입니다")
    @Size(max = 200, message = "상품명은 200자 이하여야 합니다")
    String name,

    String description,

    @NotNull(message = "가격은 필수입니다")
    @DecimalMin(value = "0.01", message = "가격은 0보다 커야 합니다")
    BigDecimal price,

    @NotNull(message = "상품 유형은 필수입니다")
    ProductType type,

    @NotNull(message = "카테고리 ID는 필수입니다")
    Long categoryId,

    String imageUrl,

    String downloadUrl,

    @PositiveOrZero(message = "재고는 0 이상이어야 합니다")
    Integer stockQuantity  // null이면 재고를 추적하지 않음
) {}
