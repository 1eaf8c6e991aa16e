package com.backoffice.domain.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CartItem Entity 테스트")
class CartItemTest {

    @Test
    @DisplayName("같은 상품을 다시 담으면 수량이 합쳐진다")
    void addQuantity() {
        // given
        CartItem cartItem = new CartItem(1L, 10L, 2);

        // when
        cartItem.addQuantity(3);

        // then
        assertThat(cartItem.getQuantity()).isEqualTo(5);
    }

    @Test
    @DisplayName("수량은 1개 이상이어야 한다")
    void changeQuantity_Zero_ThrowsException() {
        // given
        CartItem cartItem = new CartItem(1L, 10L, 2);

        // when & then
        assertThatThrownBy(() -> cartItem.changeQuantity(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cartItem.getQuantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("소유자만 일치로 판단한다")
    void isOwnedBy() {
        // given
        CartItem cartItem = new CartItem(1L, 10L, 1);

        // when & then
        assertThat(cartItem.isOwnedBy(1L)).isTrue();
        assertThat(cartItem.isOwnedBy(2L)).isFalse();
    }
}
