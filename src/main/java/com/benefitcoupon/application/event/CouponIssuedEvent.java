package com.benefitcoupon.application.event;

import com.benefitcoupon.domain.entity.Coupon;

import java.time.Instant;

/**
 * 쿠폰 발급 완료 이벤트
 */
public record CouponIssuedEvent(
        Long couponId,
        Long benefitId,
        Long userId,
        String deviceId,
        Instant issuedAt,
        Instant expireAt
) {

    public static CouponIssuedEvent from(Coupon coupon) {
        return new CouponIssuedEvent(
                coupon.getId(),
                coupon.getBenefitId(),
                coupon.getUserId(),
                coupon.getDeviceId(),
                coupon.getIssuedAt(),
                coupon.getExpireAt()
        );
    }
}
