package com.backoffice.application.dto;

import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.ProductType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record ProductResponse(
    Long productId,
    String name,
    String description,
    BigDecimal price,
    ProductType type,
    Long categoryId,
    String imageUrl,
    String downloadUrl,
    Integer stockQuantity,
    Boolean isActive,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static ProductResponse from(Product product) {
        return new ProductResponse(
            product.getId(),
            product.getName(),
            product.getDescription(),
            product.getPrice(),
            product.getType(),
            product.getCategoryId(),
            product.getImageUrl(),
            product.getDownloadUrl(),
            product.getStockQuantity(),
            product.isActive(),
            product.getCreatedAt(),
            product.getUpdatedAt()
        );
    }
}
