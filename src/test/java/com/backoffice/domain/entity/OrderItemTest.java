package com.backoffice.domain.entity;

import com.backoffice.domain.vo.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderItem Entity 테스트")
class OrderItemTest {

    private Product ebook() {
        Product product = new Product("Java 전자책", "PDF", new BigDecimal("29.99"), ProductType.DIGITAL_PRODUCT, 1L, 5);
        product.setId(10L);
        return product;
    }

    @Test
    @DisplayName("주문 항목은 주문 당시 상품명과 단가를 스냅샷으로 가진다")
    void createOrderItem_Snapshot() {
        // given
        Product product = ebook();

        // when
        OrderItem item = new OrderItem(100L, product, 3, Money.of("29.99"));
        product.rename("Java 전자책 2판");
        product.changePrice(new BigDecimal("39.99"));

        // then
        assertThat(item.getOrderId()).isEqualTo(100L);
        assertThat(item.getProductId()).isEqualTo(10L);
        assertThat(item.getSnapshotProductName()).isEqualTo("Java 전자책");
        assertThat(item.getUnitPrice()).isEqualByComparingTo("29.99");
    }

    @Test
    @DisplayName("합계 금액은 단가 × 수량이다")
    void createOrderItem_TotalPrice() {
        // when
        OrderItem item = new OrderItem(100L, ebook(), 3, Money.of("29.99"));

        // then
        assertThat(item.getQuantity()).isEqualTo(3);
        assertThat(item.getTotalPrice()).isEqualByComparingTo("89.97");
        assertThat(item.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("주문 ID가 없으면 생성할 수 없다")
    void createOrderItem_NullOrderId_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> new OrderItem(null, ebook(), 1, Money.of("29.99")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("주문 ID는 필수입니다");
    }

    @Test
    @DisplayName("상품 정보가 없으면 생성할 수 없다")
    void createOrderItem_NullProduct_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> new OrderItem(100L, null, 1, Money.of("29.99")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("상품 정보는 필수입니다");
    }

    @Test
    @DisplayName("수량이 1 미만이면 생성할 수 없다")
    void createOrderItem_ZeroQuantity_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> new OrderItem(100L, ebook(), 0, Money.of("29.99")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("수량은 1개 이상이어야 합니다");
    }

    @Test
    @DisplayName("단가가 없으면 생성할 수 없다")
    void createOrderItem_NullUnitPrice_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> new OrderItem(100L, ebook(), 1, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("단가는 필수입니다");
    }
}
