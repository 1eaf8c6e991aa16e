package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.Category;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaCategoryRepository extends JpaRepository<Category, Long> {
    boolean existsBySlug(String slug);
}
