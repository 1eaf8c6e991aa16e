package com.backoffice.application.dto;

import com.backoffice.domain.entity.CartItem;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.ProductType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CartItemResponse(
    Long cartItemId,
    Long productId,
    String productName,
    ProductType productType,
    BigDecimal price,
    String imageUrl,
    Boolean productActive,
    Integer quantity,
    LocalDateTime createdAt
) {

    public static CartItemResponse of(CartItem item, Product product) {
        return new CartItemResponse(
            item.getId(),
            item.getProductId(),
            product.getName(),
            product.getType(),
            product.getPrice(),
            product.getImageUrl(),
            product.isActive(),
            item.getQuantity(),
            item.getCreatedAt()
        );
    }
}
