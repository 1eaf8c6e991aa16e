package com.backoffice.application.dto;

import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.Review;
import com.backoffice.domain.entity.User;

import java.time.LocalDateTime;

/**
 * 리뷰 응답. 작성자나 상품이 조회되지 않으면 해당 이름 필드는 null입니다.
 */
public record ReviewResponse(
    Long reviewId,
    Long productId,
    String productName,
    Long userId,
    String userName,
    Integer rating,
    String comment,
    Boolean isApproved,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static ReviewResponse of(Review review, User user, Product product) {
        return new ReviewResponse(
            review.getId(),
            review.getProductId(),
            product != null ? product.getName() : null,
            review.getUserId(),
            user != null ? user.getFirstName() + " " + user.getLastName() : null,
            review.getRating(),
            review.getComment(),
            review.isApproved(),
            review.getCreatedAt(),
            review.getUpdatedAt()
        );
    }
}
