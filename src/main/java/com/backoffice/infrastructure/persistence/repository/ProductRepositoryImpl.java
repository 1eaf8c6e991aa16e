package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.Product;
import com.backoffice.domain.repository.ProductRepository;
import com.backoffice.domain.repository.ProductSearchCondition;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ProductRepositoryImpl implements ProductRepository {

    private final JpaProductRepository jpaProductRepository;
    private final EntityManager entityManager;

    @Override
    public Product save(Product product) {
        return jpaProductRepository.save(product);
    }

    @Override
    public Optional<Product> findById(Long id) {
        return jpaProductRepository.findById(id);
    }

    @Override
    public List<Product> findAllById(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jpaProductRepository.findAllById(ids);
    }

    @Override
    public List<Product> findAllByIdInWithLock(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jpaProductRepository.findAllByIdInWithLock(ids);
    }

    @Override
    public List<Product> search(ProductSearchCondition condition) {
        StringBuilder jpql = new StringBuilder("SELECT p FROM Product p");
        List<String> predicates = new ArrayList<>();
        if (condition.categoryId() != null) {
            predicates.add("p.categoryId = :categoryId");
        }
        if (condition.type() != null) {
            predicates.add("p.type = :type");
        }
        if (condition.active() != null) {
            predicates.add("p.active = :active");
        }
        if (!predicates.isEmpty()) {
            jpql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
        jpql.append(" ORDER BY p.createdAt DESC, p.id DESC");

        TypedQuery<Product> query = entityManager.createQuery(jpql.toString(), Product.class);
        if (condition.categoryId() != null) {
            query.setParameter("categoryId", condition.categoryId());
        }
        if (condition.type() != null) {
            query.setParameter("type", condition.type());
        }
        if (condition.active() != null) {
            query.setParameter("active", condition.active());
        }
        return query.setFirstResult(condition.offset())
                .setMaxResults(condition.limit())
                .getResultList();
    }

    @Override
    public List<Product> searchByKeyword(String keyword, int limit) {
        String jpql = """
                SELECT p FROM Product p
                WHERE p.active = true
                  AND (LOWER(p.name) LIKE :keyword OR LOWER(p.description) LIKE :keyword)
                ORDER BY p.name ASC
                """;
        return entityManager.createQuery(jpql, Product.class)
                .setParameter("keyword", "%" + keyword.toLowerCase(Locale.ROOT) + "%")
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public boolean existsByCategoryId(Long categoryId) {
        return jpaProductRepository.existsByCategoryId(categoryId);
    }
}
