package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.Order;
import com.backoffice.domain.repository.OrderRepository;
import com.backoffice.domain.repository.OrderSearchCondition;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderRepositoryImpl implements OrderRepository {

    private final JpaOrderRepository jpaOrderRepository;
    private final EntityManager entityManager;

    @Override
    public Order save(Order order) {
        return jpaOrderRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long id) {
        return jpaOrderRepository.findById(id);
    }

    @Override
    public Optional<Order> findByIdWithLock(Long id) {
        return jpaOrderRepository.findByIdWithLock(id);
    }

    @Override
    public List<Order> findByUserId(Long userId) {
        return jpaOrderRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId);
    }

    @Override
    public List<Order> search(OrderSearchCondition condition) {
        StringBuilder jpql = new StringBuilder("SELECT o FROM Order o");
        List<String> predicates = new ArrayList<>();
        if (condition.userId() != null) {
            predicates.add("o.userId = :userId");
        }
        if (condition.status() != null) {
            predicates.add("o.status = :status");
        }
        if (condition.paymentStatus() != null) {
            predicates.add("o.paymentStatus = :paymentStatus");
        }
        if (!predicates.isEmpty()) {
            jpql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
        jpql.append(" ORDER BY o.createdAt DESC, o.id DESC");

        TypedQuery<Order> query = entityManager.createQuery(jpql.toString(), Order.class);
        if (condition.userId() != null) {
            query.setParameter("userId", condition.userId());
        }
        if (condition.status() != null) {
            query.setParameter("status", condition.status());
        }
        if (condition.paymentStatus() != null) {
            query.setParameter("paymentStatus", condition.paymentStatus());
        }
        return query.setFirstResult(condition.offset())
                .setMaxResults(condition.limit())
                .getResultList();
    }

    @Override
    public boolean existsByCouponId(Long couponId) {
        return jpaOrderRepository.existsByCouponId(couponId);
    }
}
