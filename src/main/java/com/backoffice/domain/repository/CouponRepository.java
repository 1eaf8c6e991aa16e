package com.backoffice.domain.repository;

import com.backoffice.domain.entity.Coupon;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface CouponRepository {

    Coupon save(Coupon coupon);

    Optional<Coupon> findById(Long id);

    default Coupon getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.COUPON_NOT_FOUND));
    }

    Optional<Coupon> findByCode(String code);

    /**
     * 사용 횟수 갱신을 위해 비관적 쓰기 락으로 쿠폰을 조회합니다.
     */
    Optional<Coupon> findByCodeWithLock(String code);

    List<Coupon> findAll();

    boolean existsByCode(String code);

    void delete(Coupon coupon);
}
