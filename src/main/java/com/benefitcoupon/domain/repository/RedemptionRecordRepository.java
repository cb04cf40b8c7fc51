package com.benefitcoupon.domain.repository;

import com.benefitcoupon.domain.entity.RedemptionRecord;

import java.util.Optional;

/**
 * 쿠폰 사용 기록 저장소 (추가 전용)
 */
public interface RedemptionRecordRepository {

    RedemptionRecord save(RedemptionRecord record);

    Optional<RedemptionRecord> findByCouponId(Long couponId);
}
