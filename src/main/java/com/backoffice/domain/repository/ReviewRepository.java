package com.backoffice.domain.repository;

import com.backoffice.domain.entity.Review;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface ReviewRepository {

    Review save(Review review);

    Optional<Review> findById(Long id);

    default Review getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.REVIEW_NOT_FOUND));
    }

    boolean existsByUserIdAndProductId(Long userId, Long productId);

    /**
     * 상품의 리뷰를 승인 여부로 걸러 최신순으로 조회합니다.
     */
    List<Review> findByProductId(Long productId, boolean approved);

    /**
     * 승인 대기 중인 리뷰를 오래된 순으로 조회합니다.
     */
    List<Review> findPending();

    List<Review> findByUserId(Long userId);

    void delete(Review review);
}
