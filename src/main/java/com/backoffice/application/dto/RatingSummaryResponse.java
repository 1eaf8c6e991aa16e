package com.backoffice.application.dto;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 승인된 리뷰 기준 평점 통계. ratingDistribution은 1~5점 모든 키를 가집니다.
 */
public record RatingSummaryResponse(
    Long productId,
    BigDecimal averageRating,
    Integer totalReviews,
    Map<Integer, Long> ratingDistribution
) {}
