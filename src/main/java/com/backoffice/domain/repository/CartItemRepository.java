package com.backoffice.domain.repository;

import com.backoffice.domain.entity.CartItem;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface CartItemRepository {

    CartItem save(CartItem cartItem);

    Optional<CartItem> findById(Long id);

    /**
     * 사용자 소유의 장바구니 항목을 조회합니다. 다른 사용자의 항목은 없는 것으로 취급합니다.
     */
    default CartItem getOwnedOrThrow(Long cartItemId, Long userId) {
        return findById(cartItemId)
                .filter(item -> item.isOwnedBy(userId))
                .orElseThrow(() -> new BusinessException(ResponseCode.CART_ITEM_NOT_FOUND));
    }

    Optional<CartItem> findByUserIdAndProductId(Long userId, Long productId);

    List<CartItem> findByUserId(Long userId);

    void delete(CartItem cartItem);

    void deleteByUserId(Long userId);
}
