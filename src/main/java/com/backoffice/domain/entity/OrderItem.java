package com.backoffice.domain.entity;

import com.backoffice.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 항목 Entity
 *
 * 주문 당시의 상품명과 단가를 스냅샷으로 저장하여
 * 이후 상품 정보 변경에 영향받지 않도록 합니다. 생성 후에는 변경되지 않습니다.
 */
@Entity
@Table(name = "order_items", indexes = @Index(name = "idx_order_items_order_id", columnList = "order_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "snapshot_product_name", nullable = false, length = 200)
    private String snapshotProductName;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private Money unitPrice;

    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private Money totalPrice;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public OrderItem(Long orderId, Product product, int quantity, Money unitPrice) {
        validateConstructorParams(orderId, product, quantity, unitPrice);

        this.orderId = orderId;
        this.productId = product.getId();
        this.snapshotProductName = product.getName();
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.totalPrice = unitPrice.multiply(quantity);
        this.createdAt = LocalDateTime.now();
    }

    private void validateConstructorParams(Long orderId, Product product, int quantity, Money unitPrice) {
        if (orderId == null) {
            throw new IllegalArgumentException("주문 ID는 필수입니다");
        }
        if (product == null) {
            throw new IllegalArgumentException("상품 정보는 필수입니다");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1개 이상이어야 합니다");
        }
        if (unitPrice == null) {
            throw new IllegalArgumentException("단가는 필수입니다");
        }
    }

    public BigDecimal getUnitPrice() {
        return unitPrice.getAmount();
    }

    public BigDecimal getTotalPrice() {
        return totalPrice.getAmount();
    }

    public void setId(Long id) {
        this.id = id;
    }
}
