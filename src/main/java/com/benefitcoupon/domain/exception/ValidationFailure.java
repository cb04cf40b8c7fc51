package com.benefitcoupon.domain.exception;

/**
 * 쿠폰 사용 검증 실패 사유
 *
 * 검증 파이프라인의 각 단계는 서로 다른 사유에 대응합니다.
 */
public enum ValidationFailure {

    NOT_FOUND("NotFound", "쿠폰을 찾을 수 없습니다"),
    ALREADY_REDEEMED("AlreadyRedeemed", "이미 사용된 쿠폰입니다"),
    EXPIRED("Expired", "만료된 쿠폰입니다"),
    BENEFIT_MISSING("BenefitMissing", "쿠폰의 혜택 정보를 찾을 수 없습니다"),
    MERCHANT_MISMATCH("MerchantMismatch", "이 매장에서 사용할 수 없는 쿠폰입니다"),
    MERCHANT_LOCATION_UNKNOWN("MerchantLocationUnknown", "매장 위치 정보가 없어 위치를 확인할 수 없습니다"),
    OUT_OF_GEOFENCE("OutOfGeofence", "매장 반경 밖에서는 사용할 수 없습니다"),
    OUTSIDE_TIME_WINDOW("OutsideTimeWindow", "사용 가능한 시간대가 아닙니다"),
    BLACKOUT("Blackout", "오늘은 사용할 수 없는 날입니다"),
    AMBIGUOUS_OR_NOT_FOUND("AmbiguousOrNotFound", "PIN에 해당하는 쿠폰을 특정할 수 없습니다");

    private final String reason;
    private final String message;

    ValidationFailure(String reason, String message) {
        this.reason = reason;
        this.message = message;
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }
}
