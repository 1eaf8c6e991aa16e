package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품 리뷰 Entity
 *
 * 구매한 사용자만 상품당 하나의 리뷰를 작성할 수 있으며,
 * 관리자가 승인하기 전까지는 공개 목록에 노출되지 않습니다.
 */
@Entity
@Table(name = "reviews",
        uniqueConstraints = @UniqueConstraint(name = "uk_reviews_user_product", columnNames = {"user_id", "product_id"}),
        indexes = @Index(name = "idx_reviews_product_approved", columnList = "product_id, is_approved"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Review extends BaseTimeEntity {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "comment", columnDefinition = "TEXT")
    private String comment;

    @Column(name = "is_approved", nullable = false)
    private boolean approved;

    public Review(Long userId, Long productId, int rating, String comment) {
        if (userId == null || productId == null) {
            throw new IllegalArgumentException("사용자 ID와 상품 ID는 필수입니다");
        }
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException("평점은 1점에서 5점 사이여야 합니다");
        }
        this.userId = userId;
        this.productId = productId;
        this.rating = rating;
        this.comment = comment;
        this.approved = false;
        initializeTimestamps();
    }

    /**
     * 리뷰를 승인합니다. 이미 승인된 리뷰는 그대로 둡니다.
     */
    public void approve() {
        if (approved) {
            return;
        }
        this.approved = true;
        touch();
    }
}
