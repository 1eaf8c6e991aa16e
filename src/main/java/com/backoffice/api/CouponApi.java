package com.backoffice.api;

import com.backoffice.application.dto.*;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Coupon", description = "쿠폰 API")
@RequestMapping("/api/coupons")
public interface CouponApi {

    @Operation(summary = "쿠폰 생성")
    @PostMapping
    ApiResponse<CouponResponse> createCoupon(@Valid @RequestBody CouponCreateRequest request);

    @Operation(summary = "쿠폰 목록 조회")
    @GetMapping
    ApiResponse<List<CouponResponse>> getCoupons();

    @Operation(summary = "쿠폰 코드 조회", description = "지금 사용할 수 있는 쿠폰이면 반환하고, 아니면 data가 null입니다.")
    @GetMapping("/code/{code}")
    ApiResponse<CouponResponse> getCouponByCode(
            @Parameter(description = "쿠폰 코드", required = true, example = "SAVE10")
            @PathVariable String code
    );

    @Operation(summary = "쿠폰 검증", description = "주문 금액에 쿠폰을 적용할 수 있는지와 할인 금액을 반환합니다.")
    @PostMapping("/validate")
    ApiResponse<CouponValidationResponse> validateCoupon(@Valid @RequestBody CouponValidateRequest request);

    @Operation(summary = "쿠폰 수정", description = "활성 여부, 사용 한도, 만료 일시를 변경합니다.")
    @PatchMapping("/{couponId}")
    ApiResponse<CouponResponse> updateCoupon(
            @Parameter(description = "쿠폰 ID", required = true, example = "1")
            @PathVariable Long couponId,
            @Valid @RequestBody CouponUpdateRequest request
    );

    @Operation(summary = "쿠폰 삭제", description = "주문에 사용된 쿠폰은 삭제할 수 없습니다.")
    @DeleteMapping("/{couponId}")
    ApiResponse<Void> deleteCoupon(
            @Parameter(description = "쿠폰 ID", required = true, example = "1")
            @PathVariable Long couponId
    );
}
