package com.backoffice.application.dto;

import com.backoffice.domain.service.CouponEvaluation;

import java.math.BigDecimal;

/**
 * 쿠폰 검증 결과. 적용할 수 없으면 valid=false와 사유(error)를 담습니다.
 */
public record CouponValidationResponse(
    boolean valid,
    CouponResponse coupon,
    BigDecimal discount,
    String errorCode,
    String error
) {

    public static CouponValidationResponse from(CouponEvaluation evaluation) {
        if (evaluation.isApplicable()) {
            return new CouponValidationResponse(
                true,
                CouponResponse.from(evaluation.coupon()),
                evaluation.discount().getAmount(),
                null,
                null
            );
        }
        return new CouponValidationResponse(
            false,
            null,
            null,
            evaluation.violation().getCode(),
            evaluation.violation().getMessage()
        );
    }
}
