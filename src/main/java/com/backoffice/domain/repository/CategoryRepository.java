package com.backoffice.domain.repository;

import com.backoffice.domain.entity.Category;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CategoryRepository {

    Category save(Category category);

    Optional<Category> findById(Long id);

    default Category getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.CATEGORY_NOT_FOUND));
    }

    List<Category> findAll();

    List<Category> findAllById(Collection<Long> ids);

    boolean existsById(Long id);

    boolean existsBySlug(String slug);
}
