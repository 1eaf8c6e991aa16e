package com.backoffice.infrastructure.persistence.repository;

import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.repository.CouponRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CouponRepositoryImpl implements CouponRepository {

    private final JpaCouponRepository jpaCouponRepository;

    @Override
    public Coupon save(Coupon coupon) {
        return jpaCouponRepository.save(coupon);
    }

    @Override
    public Optional<Coupon> findById(Long id) {
        return jpaCouponRepository.findById(id);
    }

    @Override
    public Optional<Coupon> findByCode(String code) {
        return jpaCouponRepository.findByCode(code);
    }

    @Override
    public Optional<Coupon> findByCodeWithLock(String code) {
        return jpaCouponRepository.findByCodeWithLock(code);
    }

    @Override
    public List<Coupon> findAll() {
        return jpaCouponRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    @Override
    public boolean existsByCode(String code) {
        return jpaCouponRepository.existsByCode(code);
    }

    @Override
    public void delete(Coupon coupon) {
        jpaCouponRepository.delete(coupon);
    }
}
