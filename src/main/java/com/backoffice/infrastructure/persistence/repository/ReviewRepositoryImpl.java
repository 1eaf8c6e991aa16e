package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.Review;
import com.backoffice.domain.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ReviewRepositoryImpl implements ReviewRepository {

    private final JpaReviewRepository jpaReviewRepository;

    @Override
    public Review save(Review review) {
        return jpaReviewRepository.save(review);
    }

    @Override
    public Optional<Review> findById(Long id) {
        return jpaReviewRepository.findById(id);
    }

    @Override
    public boolean existsByUserIdAndProductId(Long userId, Long productId) {
        return jpaReviewRepository.existsByUserIdAndProductId(userId, productId);
    }

    @Override
    public List<Review> findByProductId(Long productId, boolean approved) {
        return jpaReviewRepository.findByProductIdAndApprovedOrderByCreatedAtDescIdDesc(productId, approved);
    }

    @Override
    public List<Review> findPending() {
        return jpaReviewRepository.findByApprovedFalseOrderByCreatedAtAscIdAsc();
    }

    @Override
    public List<Review> findByUserId(Long userId) {
        return jpaReviewRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId);
    }

    @Override
    public void delete(Review review) {
        jpaReviewRepository.delete(review);
    }
}
