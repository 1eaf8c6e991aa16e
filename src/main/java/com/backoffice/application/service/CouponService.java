package com.backoffice.application.service;

import com.backoffice.application.dto.CouponCreateRequest;
import com.backoffice.application.dto.CouponResponse;
import com.backoffice.application.dto.CouponUpdateRequest;
import com.backoffice.application.dto.CouponValidateRequest;
import com.backoffice.application.dto.CouponValidationResponse;
import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.repository.CouponRepository;
import com.backoffice.domain.repository.OrderRepository;
import com.backoffice.domain.service.CouponDomainService;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 쿠폰 관리 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CouponService {

    private final CouponRepository couponRepository;
    private final OrderRepository orderRepository;
    private final CouponDomainService couponDomainService;

    @Transactional
    public CouponResponse createCoupon(CouponCreateRequest request) {
        if (couponRepository.existsByCode(request.code())) {
            throw new BusinessException(ResponseCode.COUPON_CODE_DUPLICATED);
        }

        Coupon coupon = new Coupon(
                request.code(),
                request.type(),
                request.value(),
                request.minimumOrderAmount(),
                request.usageLimit(),
                request.expiresAt()
        );
        couponRepository.save(coupon);

        log.info("쿠폰 생성: couponId={}, code={}, type={}, value={}",
                coupon.getId(), coupon.getCode(), coupon.getDiscountType(), coupon.getValue());
        return CouponResponse.from(coupon);
    }

    @Transactional(readOnly = true)
    public List<CouponResponse> getCoupons() {
        return couponRepository.findAll().stream()
                .map(CouponResponse::from)
                .toList();
    }

    /**
     * 지금 사용할 수 있는(활성, 미만료, 한도 잔여) 쿠폰만 반환하고, 그 외에는 null을 반환합니다.
     */
    @Transactional(readOnly = true)
    public CouponResponse getUsableCouponByCode(String code) {
        LocalDateTime now = LocalDateTime.now();
        return couponRepository.findByCode(code)
                .filter(Coupon::isActive)
                .filter(coupon -> !coupon.isExpired(now))
                .filter(coupon -> !coupon.isExhausted())
                .map(CouponResponse::from)
                .orElse(null);
    }

    /**
     * 주문 생성과 같은 규칙으로 쿠폰 적용 가능 여부를 판정합니다. 예외를 던지지 않습니다.
     */
    @Transactional(readOnly = true)
    public CouponValidationResponse validateCoupon(CouponValidateRequest request) {
        return CouponValidationResponse.from(
                couponDomainService.evaluate(request.code(), Money.of(request.orderAmount())));
    }

    @Transactional
    public CouponResponse updateCoupon(Long couponId, CouponUpdateRequest request) {
        Coupon coupon = couponRepository.getByIdOrThrow(couponId);

        if (request.isActive() != null) {
            coupon.changeActive(request.isActive());
        }
        if (request.usageLimit() != null) {
            if (request.usageLimit() < coupon.getUsedCount()) {
                throw new BusinessException(ResponseCode.BAD_REQUEST,
                        "사용 한도는 이미 사용된 횟수(" + coupon.getUsedCount() + ")보다 작을 수 없습니다");
            }
            coupon.changeUsageLimit(request.usageLimit());
        }
        if (request.expiresAt() != null) {
            coupon.changeExpiresAt(request.expiresAt());
        }
        couponRepository.save(coupon);

        log.info("쿠폰 수정: couponId={}", couponId);
        return CouponResponse.from(coupon);
    }

    /**
     * 주문에서 참조 중인 쿠폰은 주문 금액 이력을 보존하기 위해 삭제할 수 없습니다.
     */
    @Transactional
    public void deleteCoupon(Long couponId) {
        Coupon coupon = couponRepository.getByIdOrThrow(couponId);
        if (orderRepository.existsByCouponId(couponId)) {
            throw new BusinessException(ResponseCode.COUPON_IN_USE);
        }
        couponRepository.delete(coupon);

        log.info("쿠폰 삭제: couponId={}, code={}", couponId, coupon.getCode());
    }
}
