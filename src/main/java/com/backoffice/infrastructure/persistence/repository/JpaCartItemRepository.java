package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface JpaCartItemRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findByUserIdOrderByCreatedAtAscIdAsc(Long userId);

    Optional<CartItem> findByUserIdAndProductId(Long userId, Long productId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM CartItem c WHERE c.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
