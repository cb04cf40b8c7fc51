package com.benefitcoupon.domain.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * 쿠폰 토큰 및 PIN 생성기
 *
 * 토큰은 베어러 자격 증명으로 취급되므로 예측 불가능해야 합니다.
 * PIN은 오프라인 보조 수단으로 전역 유일성을 보장하지 않습니다.
 */
@Component
public class TokenIssuer {

    private static final int PIN_MIN = 1000;
    private static final int PIN_BOUND = 10000;

    private final SecureRandom random = new SecureRandom();

    /**
     * UUIDv4 토큰 (122bit 난수, 내부적으로 SecureRandom 사용)
     */
    public String newToken() {
        return UUID.randomUUID().toString();
    }

    /**
     * 1000~9999 범위에서 균등 추출한 4자리 PIN
     */
    public String newPin() {
        return String.valueOf(PIN_MIN + random.nextInt(PIN_BOUND - PIN_MIN));
    }
}
