package com.benefitcoupon.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 쿠폰 엔진 공통 설정
 *
 * 모든 시각은 이 Clock에서 읽습니다 (UTC).
 */
@Configuration
@EnableConfigurationProperties(CouponProperties.class)
public class CouponEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
