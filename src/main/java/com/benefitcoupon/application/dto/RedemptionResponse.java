package com.benefitcoupon.application.dto;

import com.benefitcoupon.domain.service.Redemption;

import java.time.Instant;

public record RedemptionResponse(
    Long redemptionId,
    Long couponId,
    Long benefitId,
    Long merchantId,
    Long redeemedBy,
    String location,
    Instant redeemedAt
) {

    public static RedemptionResponse from(Redemption redemption) {
        return new RedemptionResponse(
                redemption.record().getId(),
                redemption.coupon().getId(),
                redemption.coupon().getBenefitId(),
                redemption.record().getMerchantId(),
                redemption.record().getRedeemedBy(),
                redemption.record().getLocation() != null ? redemption.record().getLocation().toWkt() : null,
                redemption.record().getRedeemedAt()
        );
    }
}
