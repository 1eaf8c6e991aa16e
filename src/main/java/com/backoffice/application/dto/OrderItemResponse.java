package com.backoffice.application.dto;

import com.backoffice.domain.entity.OrderItem;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.ProductType;

import java.math.BigDecimal;

/**
 * 주문 항목 응답. 상품이 삭제되어 조회되지 않으면 productType과 downloadUrl은 null입니다.
 */
public record OrderItemResponse(
    Long orderItemId,
    Long productId,
    String productName,
    ProductType productType,
    String downloadUrl,
    Integer quantity,
    BigDecimal unitPrice,
    BigDecimal totalPrice
) {

    public static OrderItemResponse of(OrderItem item, Product product) {
        return new OrderItemResponse(
            item.getId(),
            item.getProductId(),
            item.getSnapshotProductName(),
            product != null ? product.getType() : null,
            product != null ? product.getDownloadUrl() : null,
            item.getQuantity(),
            item.getUnitPrice(),
            item.getTotalPrice()
        );
    }
}
