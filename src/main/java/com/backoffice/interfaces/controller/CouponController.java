package com.backoffice.interfaces.controller;

import com.backoffice.api.CouponApi;
import com.backoffice.application.dto.*;
import com.backoffice.application.service.CouponService;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class CouponController implements CouponApi {

    private final CouponService couponService;

    @Override
    public ApiResponse<CouponResponse> createCoupon(CouponCreateRequest request) {
        return ApiResponse.of(ResponseCode.COUPON_CREATED, couponService.createCoupon(request));
    }

    @Override
    public ApiResponse<List<CouponResponse>> getCoupons() {
        return ApiResponse.of(ResponseCode.COUPON_SUCCESS, couponService.getCoupons());
    }

    @Override
    public ApiResponse<CouponResponse> getCouponByCode(String code) {
        return ApiResponse.of(ResponseCode.COUPON_SUCCESS, couponService.getUsableCouponByCode(code));
    }

    @Override
    public ApiResponse<CouponValidationResponse> validateCoupon(CouponValidateRequest request) {
        return ApiResponse.of(ResponseCode.COUPON_SUCCESS, couponService.validateCoupon(request));
    }

    @Override
    public ApiResponse<CouponResponse> updateCoupon(Long couponId, CouponUpdateRequest request) {
        return ApiResponse.of(ResponseCode.COUPON_UPDATED, couponService.updateCoupon(couponId, request));
    }

    @Override
    public ApiResponse<Void> deleteCoupon(Long couponId) {
        couponService.deleteCoupon(couponId);
        return ApiResponse.of(ResponseCode.COUPON_DELETED, null);
    }
}
