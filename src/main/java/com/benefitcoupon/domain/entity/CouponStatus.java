package com.benefitcoupon.domain.entity;

/**
 * 쿠폰 상태 (저장하지 않고 redeemedAt / expireAt / 현재 시각으로 계산)
 */
public enum CouponStatus {

    PENDING("active"),
    REDEEMED("used"),
    EXPIRED("expired");

    private final String queryValue;

    CouponStatus(String queryValue) {
        this.queryValue = queryValue;
    }

    public String getQueryValue() {
        return queryValue;
    }

    /**
     * 조회 파라미터 (active|used|expired)를 상태로 변환합니다.
     */
    public static CouponStatus fromQueryValue(String value) {
        for (CouponStatus status : values()) {
            if (status.queryValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("지원하지 않는 쿠폰 상태입니다: " + value);
    }
}
