package com.backoffice.application.service;

import com.backoffice.application.dto.RatingSummaryResponse;
import com.backoffice.application.dto.ReviewCreateRequest;
import com.backoffice.application.dto.ReviewResponse;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.Review;
import com.backoffice.domain.entity.User;
import com.backoffice.domain.repository.OrderItemRepository;
import com.backoffice.domain.repository.ProductRepository;
import com.backoffice.domain.repository.ReviewRepository;
import com.backoffice.domain.repository.UserRepository;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 상품 리뷰 서비스
 *
 * 책임:
 * - 리뷰 작성 자격 검증 (활성 사용자, 구매 이력, 상품당 1회)
 * - 승인 대기 / 승인 / 반려 처리
 * - 평점 통계
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    private final ReviewRepository reviewRepository;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final OrderItemRepository orderItemRepository;

    /**
     * 리뷰 작성. 새 리뷰는 승인 대기 상태로 저장됩니다.
     *
     * 검증 순서: 사용자 → 상품 → 구매 이력 → 중복 작성.
     */
    @Transactional
    public ReviewResponse createReview(ReviewCreateRequest request) {
        User user = userRepository.getActiveByIdOrThrow(request.userId());
        Product product = productRepository.getByIdOrThrow(request.productId());

        if (!orderItemRepository.existsPurchase(user.getId(), product.getId())) {
            throw new BusinessException(ResponseCode.REVIEW_NOT_PURCHASED);
        }
        if (reviewRepository.existsByUserIdAndProductId(user.getId(), product.getId())) {
            throw new BusinessException(ResponseCode.REVIEW_DUPLICATED);
        }

        Review review = new Review(user.getId(), product.getId(), request.rating(), request.comment());
        reviewRepository.save(review);

        log.info("리뷰 등록: reviewId={}, userId={}, productId={}, rating={}",
                review.getId(), user.getId(), product.getId(), review.getRating());
        return ReviewResponse.of(review, user, product);
    }

    /**
     * 상품 리뷰 목록. 기본은 승인된 리뷰만 조회합니다.
     */
    @Transactional(readOnly = true)
    public List<ReviewResponse> getProductReviews(Long productId, Boolean approved) {
        return toResponses(reviewRepository.findByProductId(productId, approved == null || approved));
    }

    @Transactional(readOnly = true)
    public List<ReviewResponse> getPendingReviews() {
        return toResponses(reviewRepository.findPending());
    }

    @Transactional(readOnly = true)
    public List<ReviewResponse> getUserReviews(Long userId) {
        return toResponses(reviewRepository.findByUserId(userId));
    }

    @Transactional
    public ReviewResponse approveReview(Long reviewId) {
        Review review = reviewRepository.getByIdOrThrow(reviewId);
        review.approve();
        reviewRepository.save(review);

        log.info("리뷰 승인: reviewId={}", reviewId);
        return toResponses(List.of(review)).get(0);
    }

    /**
     * 리뷰 반려. 반려된 리뷰는 삭제되어 같은 사용자가 다시 작성할 수 있습니다.
     */
    @Transactional
    public void rejectReview(Long reviewId) {
        Review review = reviewRepository.getByIdOrThrow(reviewId);
        reviewRepository.delete(review);

        log.info("리뷰 반려: reviewId={}, userId={}, productId={}", reviewId, review.getUserId(), review.getProductId());
    }

    /**
     * 승인된 리뷰의 평균 평점(소수점 둘째 자리 반올림)과 점수별 개수.
     */
    @Transactional(readOnly = true)
    public RatingSummaryResponse getRatingSummary(Long productId) {
        List<Review> approvedReviews = reviewRepository.findByProductId(productId, true);

        Map<Integer, Long> distribution = new TreeMap<>();
        for (int rating = Review.MIN_RATING; rating <= Review.MAX_RATING; rating++) {
            distribution.put(rating, 0L);
        }
        approvedReviews.forEach(review -> distribution.merge(review.getRating(), 1L, Long::sum));

        BigDecimal average = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        if (!approvedReviews.isEmpty()) {
            int sum = approvedReviews.stream().mapToInt(Review::getRating).sum();
            average = BigDecimal.valueOf(sum)
                    .divide(BigDecimal.valueOf(approvedReviews.size()), 2, RoundingMode.HALF_UP);
        }

        return new RatingSummaryResponse(productId, average, approvedReviews.size(), distribution);
    }

    private List<ReviewResponse> toResponses(List<Review> reviews) {
        if (reviews.isEmpty()) {
            return List.of();
        }
        Map<Long, User> users = userRepository.findAllById(
                        reviews.stream().map(Review::getUserId).distinct().toList()).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
        Map<Long, Product> products = productRepository.findAllById(
                        reviews.stream().map(Review::getProductId).distinct().toList()).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        return reviews.stream()
                .map(review -> ReviewResponse.of(review,
                        users.get(review.getUserId()), products.get(review.getProductId())))
                .toList();
    }
}
