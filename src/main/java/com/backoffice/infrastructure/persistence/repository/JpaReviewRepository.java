package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.Review;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaReviewRepository extends JpaRepository<Review, Long> {

    boolean existsByUserIdAndProductId(Long userId, Long productId);

    List<Review> findByProductIdAndApprovedOrderByCreatedAtDescIdDesc(Long productId, boolean approved);

    List<Review> findByApprovedFalseOrderByCreatedAtAscIdAsc();

    List<Review> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);
}
