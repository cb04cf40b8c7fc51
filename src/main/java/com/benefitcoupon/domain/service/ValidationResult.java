package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.exception.ValidationFailure;

/**
 * 검증 결과. 실패 시 첫 번째로 실패한 단계의 사유 하나만 담습니다.
 *
 * @param distanceFormatted 지오펜스 실패 시 현재 거리 표기, 그 외 null
 */
public record ValidationResult(boolean valid, Coupon coupon, ValidationFailure failure,
                               String message, String distanceFormatted) {

    public static ValidationResult valid(Coupon coupon) {
        return new ValidationResult(true, coupon, null, null, null);
    }

    public static ValidationResult invalid(ValidationFailure failure) {
        return new ValidationResult(false, null, failure, failure.getMessage(), null);
    }

    public static ValidationResult outOfGeofence(String message, String distanceFormatted) {
        return new ValidationResult(false, null, ValidationFailure.OUT_OF_GEOFENCE, message, distanceFormatted);
    }

    public String reason() {
        return failure == null ? null : failure.getReason();
    }

    public String code() {
        return failure == null ? null : failure.name();
    }
}
