package com.backoffice.domain.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Product Entity 테스트")
class ProductTest {

    private Product trackedProduct(int stock) {
        return new Product("Java 전자책", "PDF", new BigDecimal("29.99"), ProductType.DIGITAL_PRODUCT, 1L, stock);
    }

    private Product untrackedProduct() {
        return new Product("코드 리뷰", null, new BigDecimal("9.99"), ProductType.SERVICE, 1L, null);
    }

    @Test
    @DisplayName("재고 차감 시 재고가 감소한다")
    void reduceStock_ShouldDecreaseStock() {
        // given
        Product product = trackedProduct(10);

        // when
        product.reduceStock(3);

        // then
        assertThat(product.getStockQuantity()).isEqualTo(7);
    }

    @Test
    @DisplayName("재고 부족 시 차감하면 예외가 발생한다")
    void reduceStock_ShouldThrowException_WhenStockIsInsufficient() {
        // given
        Product product = trackedProduct(2);

        // when & then
        assertThatThrownBy(() -> product.reduceStock(3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("재고 부족");
        assertThat(product.getStockQuantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("재고를 추적하지 않는 상품은 차감/복구해도 재고가 null로 유지된다")
    void untrackedProduct_StockStaysNull() {
        // given
        Product product = untrackedProduct();

        // when
        product.reduceStock(1000);
        product.restoreStock(5);

        // then
        assertThat(product.isStockTracked()).isFalse();
        assertThat(product.hasStock(Integer.MAX_VALUE)).isTrue();
        assertThat(product.getStockQuantity()).isNull();
    }

    @Test
    @DisplayName("재고 복구 시 재고가 증가한다")
    void restoreStock_ShouldIncreaseStock() {
        // given
        Product product = trackedProduct(10);
        product.reduceStock(4);

        // when
        product.restoreStock(4);

        // then
        assertThat(product.getStockQuantity()).isEqualTo(10);
    }

    @Test
    @DisplayName("가격은 0.01 이내의 차이까지 일치로 판단한다")
    void matchesPrice_WithinTolerance() {
        // given
        Product product = trackedProduct(10);

        // when & then
        assertThat(product.matchesPrice(new BigDecimal("29.99"))).isTrue();
        assertThat(product.matchesPrice(new BigDecimal("30.00"))).isTrue();
        assertThat(product.matchesPrice(new BigDecimal("25.00"))).isFalse();
    }

    @Test
    @DisplayName("클라이언트 가격은 반올림하지 않고 비교한다")
    void matchesPrice_ComparesUnroundedValue() {
        // given
        Product product = trackedProduct(10);

        // when & then
        assertThat(product.matchesPrice(new BigDecimal("29.975"))).isFalse();
        assertThat(product.matchesPrice(new BigDecimal("30.005"))).isFalse();
        assertThat(product.matchesPrice(new BigDecimal("29.981"))).isTrue();
        assertThat(product.matchesPrice(null)).isFalse();
    }

    @Test
    @DisplayName("가격이 0 이하인 상품은 생성할 수 없다")
    void createProduct_InvalidPrice_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> new Product("상품", null, BigDecimal.ZERO, ProductType.SERVICE, 1L, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("가격은 0보다 커야 합니다");
    }

    @Test
    @DisplayName("음수 재고로는 생성할 수 없다")
    void createProduct_NegativeStock_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> trackedProduct(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("재고는 0 이상이어야 합니다");
    }

    @Test
    @DisplayName("삭제하면 비활성 상태가 된다")
    void deactivate() {
        // given
        Product product = trackedProduct(10);

        // when
        product.deactivate();

        // then
        assertThat(product.isActive()).isFalse();
    }
}
