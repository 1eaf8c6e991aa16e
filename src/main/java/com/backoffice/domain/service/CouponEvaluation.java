package com.backoffice.domain.service;

import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;

/**
 * 쿠폰 적용 가능 여부 판정 결과
 *
 * @param coupon    조회된 쿠폰 (존재하지 않으면 null)
 * @param discount  할인 금액 (적용 불가 시 null)
 * @param violation 위반한 규칙 (적용 가능하면 null)
 */
public record CouponEvaluation(Coupon coupon, Money discount, ResponseCode violation) {

    public static CouponEvaluation applicable(Coupon coupon, Money discount) {
        return new CouponEvaluation(coupon, discount, null);
    }

    public static CouponEvaluation rejected(Coupon coupon, ResponseCode violation) {
        return new CouponEvaluation(coupon, null, violation);
    }

    public boolean isApplicable() {
        return violation == null;
    }
}
