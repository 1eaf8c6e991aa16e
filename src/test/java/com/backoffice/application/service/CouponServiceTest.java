package com.backoffice.application.service;

import com.backoffice.application.dto.CouponCreateRequest;
import com.backoffice.application.dto.CouponResponse;
import com.backoffice.application.dto.CouponUpdateRequest;
import com.backoffice.application.dto.CouponValidateRequest;
import com.backoffice.application.dto.CouponValidationResponse;
import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.entity.DiscountType;
import com.backoffice.domain.repository.CouponRepository;
import com.backoffice.domain.repository.OrderRepository;
import com.backoffice.domain.service.CouponDomainService;
import com.backoffice.domain.service.CouponPolicy;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CouponService 테스트")
class CouponServiceTest {

    @Mock
    private CouponRepository couponRepository;
    @Mock
    private OrderRepository orderRepository;

    private CouponService couponService;

    @BeforeEach
    void setUp() {
        couponService = new CouponService(couponRepository, orderRepository,
                new CouponDomainService(couponRepository, new CouponPolicy()));
    }

    private Coupon save10() {
        Coupon coupon = new Coupon("SAVE10", DiscountType.PERCENTAGE, BigDecimal.TEN, null, 100, null);
        coupon.setId(1L);
        return coupon;
    }

    @Test
    @DisplayName("중복된 코드로 쿠폰을 생성하면 COUPON_CODE_DUPLICATED")
    void createCoupon_DuplicatedCode() {
        // given
        when(couponRepository.existsByCode("SAVE10")).thenReturn(true);
        CouponCreateRequest request = new CouponCreateRequest(
                "SAVE10", DiscountType.PERCENTAGE, BigDecimal.TEN, null, null, null);

        // when & then
        assertThatThrownBy(() -> couponService.createCoupon(request))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getResponseCode())
                .isEqualTo(ResponseCode.COUPON_CODE_DUPLICATED);
        verify(couponRepository, never()).save(any());
    }

    @Test
    @DisplayName("쿠폰을 생성하면 사용 횟수 0, 활성 상태로 저장된다")
    void createCoupon() {
        // given
        when(couponRepository.existsByCode("WELCOME")).thenReturn(false);
        CouponCreateRequest request = new CouponCreateRequest(
                "WELCOME", DiscountType.FIXED_AMOUNT, new BigDecimal("5.00"), new BigDecimal("20.00"), 50, null);

        // when
        CouponResponse response = couponService.createCoupon(request);

        // then
        assertThat(response.code()).isEqualTo("WELCOME");
        assertThat(response.usedCount()).isZero();
        assertThat(response.isActive()).isTrue();
        assertThat(response.minimumOrderAmount()).isEqualByComparingTo("20.00");
        verify(couponRepository).save(any(Coupon.class));
    }

    @Test
    @DisplayName("만료된 쿠폰은 코드 조회 시 null을 반환한다")
    void getUsableCouponByCode_Expired() {
        // given
        Coupon coupon = new Coupon("OLD", DiscountType.PERCENTAGE, BigDecimal.TEN, null, null,
                LocalDateTime.now().minusDays(1));
        when(couponRepository.findByCode("OLD")).thenReturn(Optional.of(coupon));

        // when
        CouponResponse response = couponService.getUsableCouponByCode("OLD");

        // then
        assertThat(response).isNull();
    }

    @Test
    @DisplayName("사용 가능한 쿠폰은 코드로 조회된다")
    void getUsableCouponByCode() {
        // given
        when(couponRepository.findByCode("SAVE10")).thenReturn(Optional.of(save10()));

        // when
        CouponResponse response = couponService.getUsableCouponByCode("SAVE10");

        // then
        assertThat(response).isNotNull();
        assertThat(response.couponId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("쿠폰 검증은 적용 가능하면 할인 금액을 반환한다")
    void validateCoupon_Valid() {
        // given
        when(couponRepository.findByCode("SAVE10")).thenReturn(Optional.of(save10()));

        // when
        CouponValidationResponse response = couponService.validateCoupon(
                new CouponValidateRequest("SAVE10", new BigDecimal("69.97")));

        // then
        assertThat(response.valid()).isTrue();
        assertThat(response.discount()).isEqualByComparingTo("7.00");
        assertThat(response.errorCode()).isNull();
    }

    @Test
    @DisplayName("쿠폰 검증은 예외 대신 실패 사유를 반환한다")
    void validateCoupon_Invalid() {
        // given
        when(couponRepository.findByCode("NOPE")).thenReturn(Optional.empty());

        // when
        CouponValidationResponse response = couponService.validateCoupon(
                new CouponValidateRequest("NOPE", new BigDecimal("10.00")));

        // then
        assertThat(response.valid()).isFalse();
        assertThat(response.coupon()).isNull();
        assertThat(response.errorCode()).isEqualTo(ResponseCode.COUPON_INVALID.getCode());
    }

    @Test
    @DisplayName("사용 한도를 이미 사용된 횟수보다 작게 변경할 수 없다")
    void updateCoupon_UsageLimitBelowUsedCount() {
        // given
        Coupon coupon = save10();
        coupon.redeem();
        coupon.redeem();
        when(couponRepository.getByIdOrThrow(1L)).thenReturn(coupon);

        // when & then
        assertThatThrownBy(() -> couponService.updateCoupon(1L, new CouponUpdateRequest(null, 1, null)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getResponseCode())
                .isEqualTo(ResponseCode.BAD_REQUEST);
        assertThat(coupon.getUsageLimit()).isEqualTo(100);
    }

    @Test
    @DisplayName("전달된 필드만 변경한다")
    void updateCoupon_PartialUpdate() {
        // given
        Coupon coupon = save10();
        when(couponRepository.getByIdOrThrow(1L)).thenReturn(coupon);

        // when
        CouponResponse response = couponService.updateCoupon(1L, new CouponUpdateRequest(false, null, null));

        // then
        assertThat(response.isActive()).isFalse();
        assertThat(response.usageLimit()).isEqualTo(100);
        verify(couponRepository).save(coupon);
    }

    @Test
    @DisplayName("주문에서 참조 중인 쿠폰은 삭제할 수 없다")
    void deleteCoupon_InUse() {
        // given
        Coupon coupon = save10();
        when(couponRepository.getByIdOrThrow(1L)).thenReturn(coupon);
        when(orderRepository.existsByCouponId(1L)).thenReturn(true);

        // when & then
        assertThatThrownBy(() -> couponService.deleteCoupon(1L))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getResponseCode())
                .isEqualTo(ResponseCode.COUPON_IN_USE);
        verify(couponRepository, never()).delete(any());
    }

    @Test
    @DisplayName("사용되지 않은 쿠폰은 삭제된다")
    void deleteCoupon() {
        // given
        Coupon coupon = save10();
        when(couponRepository.getByIdOrThrow(1L)).thenReturn(coupon);
        when(orderRepository.existsByCouponId(1L)).thenReturn(false);

        // when
        couponService.deleteCoupon(1L);

        // then
        verify(couponRepository).delete(coupon);
    }
}
