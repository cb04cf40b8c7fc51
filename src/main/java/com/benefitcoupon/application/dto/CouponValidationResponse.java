package com.benefitcoupon.application.dto;

import com.benefitcoupon.domain.service.ValidationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CouponValidationResponse(
    boolean valid,
    Long couponId,
    String reason,
    String code,
    String message,
    String distanceFormatted
) {

    public static CouponValidationResponse from(ValidationResult result) {
        return new CouponValidationResponse(
                result.valid(),
                result.coupon() != null ? result.coupon().getId() : null,
                result.reason(),
                result.code(),
                result.message(),
                result.distanceFormatted()
        );
    }
}
