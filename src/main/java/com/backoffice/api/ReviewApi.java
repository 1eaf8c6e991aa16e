package com.backoffice.api;

import com.backoffice.application.dto.RatingSummaryResponse;
import com.backoffice.application.dto.ReviewCreateRequest;
import com.backoffice.application.dto.ReviewResponse;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Review", description = "상품 리뷰 API")
@RequestMapping("/api/reviews")
public interface ReviewApi {

    @Operation(summary = "리뷰 작성", description = "구매한 상품에 한해 상품당 한 번 작성할 수 있으며, 승인 전까지 공개되지 않습니다.")
    @PostMapping
    ApiResponse<ReviewResponse> createReview(@Valid @RequestBody ReviewCreateRequest request);

    @Operation(summary = "상품 리뷰 목록 조회", description = "기본은 승인된 리뷰만 조회합니다.")
    @GetMapping("/products/{productId}")
    ApiResponse<List<ReviewResponse>> getProductReviews(
            @Parameter(description = "상품 ID", required = true, example = "1") @PathVariable Long productId,
            @Parameter(description = "승인 여부 (기본 true)") @RequestParam(required = false) Boolean approved
    );

    @Operation(summary = "상품 평점 통계 조회", description = "승인된 리뷰의 평균 평점과 점수별 개수를 조회합니다.")
    @GetMapping("/products/{productId}/summary")
    ApiResponse<RatingSummaryResponse> getRatingSummary(
            @Parameter(description = "상품 ID", required = true, example = "1") @PathVariable Long productId
    );

    @Operation(summary = "승인 대기 리뷰 조회")
    @GetMapping("/pending")
    ApiResponse<List<ReviewResponse>> getPendingReviews();

    @Operation(summary = "사용자 리뷰 조회")
    @GetMapping("/users/{userId}")
    ApiResponse<List<ReviewResponse>> getUserReviews(
            @Parameter(description = "사용자 ID", required = true, example = "1") @PathVariable Long userId
    );

    @Operation(summary = "리뷰 승인")
    @PatchMapping("/{reviewId}/approve")
    ApiResponse<ReviewResponse> approveReview(
            @Parameter(description = "리뷰 ID", required = true, example = "1") @PathVariable Long reviewId
    );

    @Operation(summary = "리뷰 반려", description = "리뷰를 삭제합니다.")
    @DeleteMapping("/{reviewId}")
    ApiResponse<Void> rejectReview(
            @Parameter(description = "리뷰 ID", required = true, example = "1") @PathVariable Long reviewId
    );
}
