package com.backoffice.domain.service;

import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 쿠폰 적용 규칙
 *
 * 판정 순서 (처음 위반한 규칙이 결과가 됨):
 * 1. 존재하고 활성 상태인가 → COUPON_INVALID
 * 2. 만료되지 않았는가 → COUPON_EXPIRED
 * 3. 사용 한도가 남았는가 → COUPON_EXHAUSTED
 * 4. 최소 주문 금액을 충족하는가 → COUPON_MINIMUM_NOT_MET
 *
 * 주문 생성(예외)과 쿠폰 검증 API(결과 반환)가 같은 규칙을 공유합니다.
 */
@Component
public class CouponPolicy {

    public CouponEvaluation evaluate(Coupon coupon, Money orderAmount, LocalDateTime now) {
        if (coupon == null || !coupon.isActive()) {
            return CouponEvaluation.rejected(coupon, ResponseCode.COUPON_INVALID);
        }
        if (coupon.isExpired(now)) {
            return CouponEvaluation.rejected(coupon, ResponseCode.COUPON_EXPIRED);
        }
        if (coupon.isExhausted()) {
            return CouponEvaluation.rejected(coupon, ResponseCode.COUPON_EXHAUSTED);
        }
        if (coupon.isBelowMinimum(orderAmount)) {
            return CouponEvaluation.rejected(coupon, ResponseCode.COUPON_MINIMUM_NOT_MET);
        }
        return CouponEvaluation.applicable(coupon, coupon.calculateDiscount(orderAmount));
    }

    /**
     * 규칙을 위반하면 해당 코드의 BusinessException을 던지고, 통과하면 할인 금액을 반환합니다.
     */
    public Money calculateDiscountOrThrow(Coupon coupon, Money orderAmount, LocalDateTime now) {
        CouponEvaluation evaluation = evaluate(coupon, orderAmount, now);
        if (!evaluation.isApplicable()) {
            throw new BusinessException(evaluation.violation());
        }
        return evaluation.discount();
    }
}
