package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.vo.GeoPoint;

/**
 * 쿠폰 사용 요청. token이 없으면 pin으로 쿠폰을 찾습니다.
 */
public record RedeemCommand(String token, String pin, Long merchantId, GeoPoint location,
                            Long redeemedBy, String deviceId, String ipAddress) {

    public RedeemCommand {
        if (merchantId == null) {
            throw new IllegalArgumentException("가맹점 ID는 필수입니다");
        }
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    public boolean hasPin() {
        return pin != null && !pin.isBlank();
    }

    /**
     * 같은 쿠폰에 대한 동시 요청을 묶는 키
     */
    public String couponKey() {
        return hasToken() ? token : merchantId + ":" + pin;
    }
}
