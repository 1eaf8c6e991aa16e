package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.OrderItem;
import com.backoffice.domain.entity.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface JpaOrderItemRepository extends JpaRepository<OrderItem, Long> {
    List<OrderItem> findByOrderIdOrderByIdAsc(Long orderId);

    List<OrderItem> findByOrderIdInOrderByIdAsc(Collection<Long> orderIds);

    @Query("SELECT COUNT(oi) FROM OrderItem oi, Order o " +
           "WHERE o.id = oi.orderId AND o.userId = :userId AND oi.productId = :productId " +
           "AND o.status NOT IN :excludedStatuses")
    long countPurchases(@Param("userId") Long userId,
                        @Param("productId") Long productId,
                        @Param("excludedStatuses") Collection<OrderStatus> excludedStatuses);
}
