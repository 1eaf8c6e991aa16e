package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.CartItem;
import com.backoffice.domain.repository.CartItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CartItemRepositoryImpl implements CartItemRepository {

    private final JpaCartItemRepository jpaCartItemRepository;

    @Override
    public CartItem save(CartItem cartItem) {
        return jpaCartItemRepository.save(cartItem);
    }

    @Override
    public Optional<CartItem> findById(Long id) {
        return jpaCartItemRepository.findById(id);
    }

    @Override
    public Optional<CartItem> findByUserIdAndProductId(Long userId, Long productId) {
        return jpaCartItemRepository.findByUserIdAndProductId(userId, productId);
    }

    @Override
    public List<CartItem> findByUserId(Long userId) {
        return jpaCartItemRepository.findByUserIdOrderByCreatedAtAscIdAsc(userId);
    }

    @Override
    public void delete(CartItem cartItem) {
        jpaCartItemRepository.delete(cartItem);
    }

    @Override
    public void deleteByUserId(Long userId) {
        jpaCartItemRepository.deleteByUserId(userId);
    }
}
