package com.backoffice.application.dto;

import com.backoffice.domain.entity.ProductType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * 전달된(null이 아닌) 필드만 변경합니다.
 */
public record ProductUpdateRequest(
    @Size(min = 1, max = 200, message = "상품명은 1~200자여야 합니다")
    String name,

    String description,

    @DecimalMin(value = "0.01", message = "가격은 0보다 커야 합니다")
    BigDecimal price,

    ProductType type,

    Long categoryId,

    String imageUrl,

    String downloadUrl,

    @PositiveOrZero(message = "재고는 0 이상이어야 합니다")
    Integer stockQuantity,

    Boolean isActive
) {}
