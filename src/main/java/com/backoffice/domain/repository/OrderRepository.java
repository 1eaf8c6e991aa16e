package com.backoffice.domain.repository;

import com.backoffice.domain.entity.Order;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long id);

    /**
     * 상태 변경을 위해 비관적 쓰기 락으로 주문을 조회합니다.
     */
    Optional<Order> findByIdWithLock(Long id);

    default Order getByIdWithLockOrThrow(Long id) {
        return findByIdWithLock(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.ORDER_NOT_FOUND));
    }

    List<Order> findByUserId(Long userId);

    List<Order> search(OrderSearchCondition condition);

    boolean existsByCouponId(Long couponId);
}
