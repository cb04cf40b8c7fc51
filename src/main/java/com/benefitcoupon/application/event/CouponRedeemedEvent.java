package com.benefitcoupon.application.event;

import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.RedemptionRecord;

import java.time.Instant;

/**
 * 쿠폰 사용 완료 이벤트
 *
 * @param location 사용 위치 WKT (없으면 null)
 */
public record CouponRedeemedEvent(
        Long couponId,
        Long benefitId,
        Long userId,
        Long merchantId,
        Long redeemedBy,
        String location,
        Instant redeemedAt
) {

    public static CouponRedeemedEvent of(Coupon coupon, RedemptionRecord record) {
        return new CouponRedeemedEvent(
                coupon.getId(),
                coupon.getBenefitId(),
                coupon.getUserId(),
                record.getMerchantId(),
                record.getRedeemedBy(),
                record.getLocation() != null ? record.getLocation().toWkt() : null,
                record.getRedeemedAt()
        );
    }
}
