package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.OrderItem;
import com.backoffice.domain.entity.OrderStatus;
import com.backoffice.domain.repository.OrderItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class OrderItemRepositoryImpl implements OrderItemRepository {

    private static final List<OrderStatus> NOT_PURCHASED_STATUSES = List.of(OrderStatus.CANCELLED, OrderStatus.REFUNDED);

    private final JpaOrderItemRepository jpaOrderItemRepository;

    @Override
    public List<OrderItem> saveAll(List<OrderItem> orderItems) {
        return jpaOrderItemRepository.saveAll(orderItems);
    }

    @Override
    public List<OrderItem> findByOrderId(Long orderId) {
        return jpaOrderItemRepository.findByOrderIdOrderByIdAsc(orderId);
    }

    @Override
    public List<OrderItem> findByOrderIdIn(Collection<Long> orderIds) {
        if (orderIds.isEmpty()) {
            return List.of();
        }
        return jpaOrderItemRepository.findByOrderIdInOrderByIdAsc(orderIds);
    }

    @Override
    public boolean existsPurchase(Long userId, Long productId) {
        return jpaOrderItemRepository.countPurchases(userId, productId, NOT_PURCHASED_STATUSES) > 0;
    }
}
