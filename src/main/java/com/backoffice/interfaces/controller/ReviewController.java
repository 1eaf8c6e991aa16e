package com.backoffice.interfaces.controller;

import com.backoffice.api.ReviewApi;
import com.backoffice.application.dto.RatingSummaryResponse;
import com.backoffice.application.dto.ReviewCreateRequest;
import com.backoffice.application.dto.ReviewResponse;
import com.backoffice.application.service.ReviewService;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ReviewController implements ReviewApi {

    private final ReviewService reviewService;

    @Override
    public ApiResponse<ReviewResponse> createReview(ReviewCreateRequest request) {
        return ApiResponse.of(ResponseCode.REVIEW_CREATED, reviewService.createReview(request));
    }

    @Override
    public ApiResponse<List<ReviewResponse>> getProductReviews(Long productId, Boolean approved) {
        return ApiResponse.of(ResponseCode.REVIEW_SUCCESS, reviewService.getProductReviews(productId, approved));
    }

    @Override
    public ApiResponse<RatingSummaryResponse> getRatingSummary(Long productId) {
        return ApiResponse.of(ResponseCode.REVIEW_SUCCESS, reviewService.getRatingSummary(productId));
    }

    @Override
    public ApiResponse<List<ReviewResponse>> getPendingReviews() {
        return ApiResponse.of(ResponseCode.REVIEW_SUCCESS, reviewService.getPendingReviews());
    }

    @Override
    public ApiResponse<List<ReviewResponse>> getUserReviews(Long userId) {
        return ApiResponse.of(ResponseCode.REVIEW_SUCCESS, reviewService.getUserReviews(userId));
    }

    @Override
    public ApiResponse<ReviewResponse> approveReview(Long reviewId) {
        return ApiResponse.of(ResponseCode.REVIEW_APPROVED, reviewService.approveReview(reviewId));
    }

    @Override
    public ApiResponse<Void> rejectReview(Long reviewId) {
        reviewService.rejectReview(reviewId);
        return ApiResponse.of(ResponseCode.REVIEW_REJECTED, null);
    }
}
