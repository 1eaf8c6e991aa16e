package com.backoffice.domain.repository;

import com.backoffice.domain.entity.Product;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProductRepository {

    Product save(Product product);

    Optional<Product> findById(Long id);

    default Product getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.PRODUCT_NOT_FOUND));
    }

    List<Product> findAllById(Collection<Long> ids);

    /**
     * 비관적 쓰기 락(SELECT ... FOR UPDATE)으로 상품을 조회합니다.
     * 교착 상태를 피하기 위해 항상 ID 오름차순으로 락을 획득합니다.
     * 트랜잭션 안에서 호출해야 합니다.
     */
    List<Product> findAllByIdInWithLock(Collection<Long> ids);

    List<Product> search(ProductSearchCondition condition);

    /**
     * 이름 또는 설명에 키워드가 포함된 활성 상품을 대소문자 구분 없이 조회합니다.
     */
    List<Product> searchByKeyword(String keyword, int limit);

    boolean existsByCategoryId(Long categoryId);
}
