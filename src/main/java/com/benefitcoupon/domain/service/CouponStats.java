package com.benefitcoupon.domain.service;

/**
 * 쿠폰 발급/사용 통계
 *
 * @param redemptionRate 사용률 (%), 소수 첫째 자리까지
 */
public record CouponStats(long totalIssued, long totalRedeemed, double redemptionRate,
                          long activeCount, long expiredCount) {

    public static CouponStats of(long totalIssued, long totalRedeemed, long activeCount, long expiredCount) {
        double rate = totalIssued == 0
                ? 0.0
                : Math.round(totalRedeemed * 1000.0 / totalIssued) / 10.0;
        return new CouponStats(totalIssued, totalRedeemed, rate, activeCount, expiredCount);
    }
}
