package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 Entity
 * 사용자별로 상품당 한 줄만 유지하며, 같은 상품을 다시 담으면 수량을 합칩니다.
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = @UniqueConstraint(
        name = "uk_cart_items_user_product", columnNames = {"user_id", "product_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CartItem extends BaseTimeEntity {

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    public CartItem(Long userId, Long productId, int quantity) {
        if (userId == null || productId == null) {
            throw new IllegalArgumentException("사용자 ID와 상품 ID는 필수입니다");
        }
        validateQuantity(quantity);
        this.userId = userId;
        this.productId = productId;
        this.quantity = quantity;
        initializeTimestamps();
    }

    private void validateQuantity(int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1개 이상이어야 합니다");
        }
    }

    public void addQuantity(int quantity) {
        validateQuantity(quantity);
        this.quantity += quantity;
        touch();
    }

    public void changeQuantity(int quantity) {
        validateQuantity(quantity);
        this.quantity = quantity;
        touch();
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }
}
