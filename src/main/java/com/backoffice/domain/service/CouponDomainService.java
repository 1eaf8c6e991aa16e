package com.backoffice.domain.service;

import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.repository.CouponRepository;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 쿠폰 도메인 서비스
 *
 * 책임:
 * - 주문에 적용할 쿠폰을 락과 함께 조회하고 할인 금액 산정
 * - 쿠폰 사용 횟수 증가
 *
 * 주의:
 * - 트랜잭션 경계는 상위 Application Service가 관리
 * - 사용 횟수는 취소 시에도 감소시키지 않음
 */
@Service
@RequiredArgsConstructor
public class CouponDomainService {

    private final CouponRepository couponRepository;
    private final CouponPolicy couponPolicy;

    /**
     * 주문 금액에 쿠폰을 적용합니다. 쿠폰 행은 트랜잭션 종료까지 쓰기 락이 유지됩니다.
     *
     * @param couponCode  쿠폰 코드
     * @param totalAmount 할인 전 주문 금액
     * @return 락이 걸린 쿠폰과 할인 금액
     */
    public AppliedCoupon applyToOrder(String couponCode, Money totalAmount) {
        Coupon coupon = couponRepository.findByCodeWithLock(couponCode).orElse(null);
        Money discount = couponPolicy.calculateDiscountOrThrow(coupon, totalAmount, LocalDateTime.now());
        return new AppliedCoupon(coupon, discount);
    }

    /**
     * 락 없이 쿠폰 적용 가능 여부만 판정합니다.
     */
    public CouponEvaluation evaluate(String couponCode, Money orderAmount) {
        Coupon coupon = couponRepository.findByCode(couponCode).orElse(null);
        return couponPolicy.evaluate(coupon, orderAmount, LocalDateTime.now());
    }

    /**
     * 쿠폰 사용 횟수 증가
     *
     * @param coupon applyToOrder로 락을 획득한 쿠폰
     */
    public void redeem(Coupon coupon) {
        try {
            coupon.redeem();
        } catch (IllegalStateException e) {
            throw new BusinessException(ResponseCode.COUPON_EXHAUSTED, e.getMessage());
        }
        couponRepository.save(coupon);
    }

    public record AppliedCoupon(Coupon coupon, Money discount) {

        public Long couponId() {
            return coupon.getId();
        }
    }
}
