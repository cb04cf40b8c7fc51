package com.benefitcoupon.domain.repository;

import com.benefitcoupon.domain.entity.Coupon;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 쿠폰 원장 (Ledger)
 */
public interface CouponRepository {

    Coupon save(Coupon coupon);

    Optional<Coupon> findById(Long id);

    default Coupon getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new IllegalArgumentException("쿠폰을 찾을 수 없습니다: " + id));
    }

    Optional<Coupon> findByToken(String token);

    /**
     * 지정한 혜택들 중 아직 사용/만료되지 않은 쿠폰을 PIN으로 조회합니다.
     */
    List<Coupon> findPendingByPin(String pin, Collection<Long> benefitIds, Instant now);

    List<Coupon> findByUserId(Long userId);

    List<Coupon> findPendingByUserId(Long userId, Instant now);

    List<Coupon> findRedeemedByUserId(Long userId);

    List<Coupon> findExpiredByUserId(Long userId, Instant now);

    long countPendingByBenefitIdAndUserId(Long benefitId, Long userId, Instant now);

    /**
     * redeemedAt이 비어 있을 때만 사용 처리합니다.
     *
     * @return 이번 호출로 사용 처리되었으면 true, 이미 사용된 쿠폰이면 false
     */
    boolean markRedeemedIfPending(Long couponId, Instant redeemedAt);

    long countIssued(Long benefitId);

    long countRedeemed(Long benefitId);

    long countPending(Long benefitId, Instant now);

    long countExpired(Long benefitId, Instant now);
}
