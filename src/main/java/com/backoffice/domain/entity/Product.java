package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import com.backoffice.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 도메인 Entity
 * 재고 관리와 가격 검증 비즈니스 로직을 포함합니다.
 *
 * stockQuantity가 null이면 재고를 추적하지 않는 상품(서비스, 무제한 디지털 상품)입니다.
 */
@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product extends BaseTimeEntity {

    /** 클라이언트가 보낸 가격과 현재 가격 사이에 허용되는 오차 */
    public static final BigDecimal PRICE_TOLERANCE = new BigDecimal("0.01");

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private Money price;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private ProductType type;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "download_url", length = 500)
    private String downloadUrl;

    @Column(name = "stock_quantity")
    private Integer stockQuantity;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    public Product(String name, String description, BigDecimal price, ProductType type,
                   Long categoryId, Integer stockQuantity) {
        validateName(name);
        validatePrice(price);
        validateStockQuantity(stockQuantity);
        if (type == null) {
            throw new IllegalArgumentException("상품 유형은 필수입니다");
        }
        if (categoryId == null) {
            throw new IllegalArgumentException("카테고리는 필수입니다");
        }
        this.name = name;
        this.description = description;
        this.price = Money.of(price);
        this.type = type;
        this.categoryId = categoryId;
        this.stockQuantity = stockQuantity;
        this.active = true;
        initializeTimestamps();
    }

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
    }

    private void validatePrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("가격은 0보다 커야 합니다");
        }
    }

    private void validateStockQuantity(Integer stockQuantity) {
        if (stockQuantity != null && stockQuantity < 0) {
            throw new IllegalArgumentException("재고는 0 이상이어야 합니다");
        }
    }

    public BigDecimal getPrice() {
        return price.getAmount();
    }

    public boolean isStockTracked() {
        return stockQuantity != null;
    }

    /**
     * 재고가 충분한지 확인합니다. 재고를 추적하지 않는 상품은 항상 true입니다.
     */
    public boolean hasStock(int quantity) {
        return !isStockTracked() || stockQuantity >= quantity;
    }

    /**
     * 클라이언트가 알고 있는 가격이 현재 가격과 허용 오차 이내로 일치하는지 확인합니다.
     * 클라이언트 가격은 반올림하지 않고 그대로 비교합니다.
     */
    public boolean matchesPrice(BigDecimal clientPrice) {
        if (clientPrice == null) {
            return false;
        }
        return price.getAmount().subtract(clientPrice).abs().compareTo(PRICE_TOLERANCE) <= 0;
    }

    /**
     * 재고를 차감합니다. 재고를 추적하지 않는 상품은 변경하지 않습니다.
     *
     * @throws IllegalArgumentException 수량이 0 이하인 경우
     * @throws IllegalStateException 재고가 부족한 경우
     */
    public void reduceStock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("수량은 0보다 커야 합니다");
        }
        if (!isStockTracked()) {
            return;
        }
        if (!hasStock(quantity)) {
            throw new IllegalStateException(
                    "재고 부족: 현재 재고 " + this.stockQuantity + "개, 요청 수량 " + quantity + "개"
            );
        }
        this.stockQuantity -= quantity;
        touch();
    }

    /**
     * 주문 취소로 재고를 복구합니다. 재고를 추적하지 않는 상품은 변경하지 않습니다.
     */
    public void restoreStock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("수량은 0보다 커야 합니다");
        }
        if (!isStockTracked()) {
            return;
        }
        this.stockQuantity += quantity;
        touch();
    }

    public void rename(String name) {
        validateName(name);
        this.name = name;
        touch();
    }

    public void changeDescription(String description) {
        this.description = description;
        touch();
    }

    public void changePrice(BigDecimal price) {
        validatePrice(price);
        this.price = Money.of(price);
        touch();
    }

    public void changeType(ProductType type) {
        if (type == null) {
            throw new IllegalArgumentException("상품 유형은 필수입니다");
        }
        this.type = type;
        touch();
    }

    public void moveToCategory(Long categoryId) {
        if (categoryId == null) {
            throw new IllegalArgumentException("카테고리는 필수입니다");
        }
        this.categoryId = categoryId;
        touch();
    }

    public void changeImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
        touch();
    }

    public void changeDownloadUrl(String downloadUrl) {
        this.downloadUrl = downloadUrl;
        touch();
    }

    /**
     * 재고 수량을 관리자가 직접 설정합니다. null이면 재고 추적을 해제합니다.
     */
    public void changeStockQuantity(Integer stockQuantity) {
        validateStockQuantity(stockQuantity);
        this.stockQuantity = stockQuantity;
        touch();
    }

    public void changeActive(boolean active) {
        this.active = active;
        touch();
    }

    public void deactivate() {
        changeActive(false);
    }
}
