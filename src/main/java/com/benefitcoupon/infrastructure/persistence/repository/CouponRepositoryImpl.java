package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.repository.CouponRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
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
    public Optional<Coupon> findByToken(String token) {
        return jpaCouponRepository.findByToken(token);
    }

    @Override
    public List<Coupon> findPendingByPin(String pin, Collection<Long> benefitIds, Instant now) {
        if (benefitIds.isEmpty()) {
            return List.of();
        }
        return jpaCouponRepository.findPendingByPin(pin, benefitIds, now);
    }

    @Override
    public List<Coupon> findByUserId(Long userId) {
        return jpaCouponRepository.findByUserIdOrderByIssuedAtDesc(userId);
    }

    @Override
    public List<Coupon> findPendingByUserId(Long userId, Instant now) {
        return jpaCouponRepository.findPendingByUserId(userId, now);
    }

    @Override
    public List<Coupon> findRedeemedByUserId(Long userId) {
        return jpaCouponRepository.findRedeemedByUserId(userId);
    }

    @Override
    public List<Coupon> findExpiredByUserId(Long userId, Instant now) {
        return jpaCouponRepository.findExpiredByUserId(userId, now);
    }

    @Override
    public long countPendingByBenefitIdAndUserId(Long benefitId, Long userId, Instant now) {
        return jpaCouponRepository.countPendingByBenefitIdAndUserId(benefitId, userId, now);
    }

    @Override
    public boolean markRedeemedIfPending(Long couponId, Instant redeemedAt) {
        return jpaCouponRepository.markRedeemedIfPending(couponId, redeemedAt) == 1;
    }

    @Override
    public long countIssued(Long benefitId) {
        return jpaCouponRepository.countIssued(benefitId);
    }

    @Override
    public long countRedeemed(Long benefitId) {
        return jpaCouponRepository.countRedeemed(benefitId);
    }

    @Override
    public long countPending(Long benefitId, Instant now) {
        return jpaCouponRepository.countPending(benefitId, now);
    }

    @Override
    public long countExpired(Long benefitId, Instant now) {
        return jpaCouponRepository.countExpired(benefitId, now);
    }
}
