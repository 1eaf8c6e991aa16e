package com.backoffice.domain.repository;

import com.backoffice.domain.entity.OrderItem;

import java.util.Collection;
import java.util.List;

public interface OrderItemRepository {

    List<OrderItem> saveAll(List<OrderItem> orderItems);

    List<OrderItem> findByOrderId(Long orderId);

    /**
     * 여러 주문의 항목을 한 번의 쿼리로 조회합니다.
     */
    List<OrderItem> findByOrderIdIn(Collection<Long> orderIds);

    /**
     * 사용자가 취소되거나 환불되지 않은 주문으로 상품을 구매한 적이 있는지 확인합니다.
     */
    boolean existsPurchase(Long userId, Long productId);
}
