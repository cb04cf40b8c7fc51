package com.benefitcoupon.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TokenIssuer 테스트")
class TokenIssuerTest {

    private final TokenIssuer tokenIssuer = new TokenIssuer();

    @Test
    @DisplayName("토큰은 UUID 버전 4 형식이다")
    void newToken_isUuidV4() {
        // when
        String token = tokenIssuer.newToken();

        // then
        assertThat(UUID.fromString(token).version()).isEqualTo(4);
        assertThat(token).hasSize(36);
    }

    @Test
    @DisplayName("토큰은 매번 다르다")
    void newToken_isUnique() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            tokens.add(tokenIssuer.newToken());
        }

        assertThat(tokens).hasSize(10_000);
    }

    @Test
    @DisplayName("PIN은 1000~9999 범위의 4자리 숫자다")
    void newPin_inRange() {
        for (int i = 0; i < 10_000; i++) {
            String pin = tokenIssuer.newPin();

            assertThat(pin).matches("\\d{4}");
            assertThat(Integer.parseInt(pin)).isBetween(1000, 9999);
        }
    }
}
