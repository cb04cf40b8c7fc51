package com.benefitcoupon.application.dto;

import com.benefitcoupon.domain.entity.Coupon;

import java.time.Instant;

/**
 * @param status active | used | expired
 */
public record CouponResponse(
    Long id,
    Long benefitId,
    Long userId,
    String token,
    String pin,
    String status,
    Instant issuedAt,
    Instant expireAt,
    Instant redeemedAt
) {

    public static CouponResponse from(Coupon coupon, Instant now) {
        return new CouponResponse(
                coupon.getId(),
                coupon.getBenefitId(),
                coupon.getUserId(),
                coupon.getToken(),
                coupon.getPin(),
                coupon.statusAt(now).getQueryValue(),
                coupon.getIssuedAt(),
                coupon.getExpireAt(),
                coupon.getRedeemedAt()
        );
    }
}
