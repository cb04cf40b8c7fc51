package com.benefitcoupon.application.dto;

import com.benefitcoupon.domain.service.CouponStats;

/**
 * @param redemptionRate 사용률 (%)
 */
public record CouponStatsResponse(
    Long benefitId,
    long totalIssued,
    long totalRedeemed,
    double redemptionRate,
    long activeCount,
    long expiredCount
) {

    public static CouponStatsResponse of(Long benefitId, CouponStats stats) {
        return new CouponStatsResponse(
                benefitId,
                stats.totalIssued(),
                stats.totalRedeemed(),
                stats.redemptionRate(),
                stats.activeCount(),
                stats.expiredCount()
        );
    }
}
