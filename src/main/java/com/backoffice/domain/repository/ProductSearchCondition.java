package com.backoffice.domain.repository;

import com.backoffice.domain.entity.ProductType;

/**
 * 상품 목록 조회 조건. null인 필드는 조건에서 제외됩니다.
 */
public record ProductSearchCondition(
        Long categoryId,
        ProductType type,
        Boolean active,
        int limit,
        int offset
) {
}
