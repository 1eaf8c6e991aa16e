package com.backoffice.application.dto;

import com.backoffice.domain.entity.Category;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.Review;
import com.backoffice.domain.entity.User;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record ProductDetailResponse(
    ProductResponse product,
    CategorySummary category,
    List<ReviewSummary> reviews
) {

    /**
     * @param reviews 승인된 리뷰 (최신순)
     * @param authors 리뷰 작성자 (ID 기준)
     */
    public static ProductDetailResponse of(Product product, Category category,
                                           List<Review> reviews, Map<Long, User> authors) {
        return new ProductDetailResponse(
            ProductResponse.from(product),
            category != null ? new CategorySummary(category.getId(), category.getName(), category.getSlug()) : null,
            reviews.stream()
                .map(review -> ReviewSummary.of(review, authors.get(review.getUserId())))
                .toList()
        );
    }

    public record CategorySummary(Long categoryId, String name, String slug) {}

    public record ReviewSummary(Long reviewId, Integer rating, String comment, String userName, LocalDateTime createdAt) {

        static ReviewSummary of(Review review, User author) {
            return new ReviewSummary(
                review.getId(),
                review.getRating(),
                review.getComment(),
                author != null ? author.getFirstName() + " " + author.getLastName() : null,
                review.getCreatedAt()
            );
        }
    }
}
