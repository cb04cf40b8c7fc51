package com.benefitcoupon.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine 로컬 캐시 설정
 *
 * 혜택/가맹점은 이 엔진에서 읽기만 하므로 짧은 TTL로 캐싱합니다.
 * 카탈로그 변경은 최대 60초 뒤에 반영됩니다.
 */
@Configuration
@EnableCaching
public class CaffeineCacheConfig {

    public static final String BENEFIT_CACHE = "benefitCache";
    public static final String MERCHANT_CACHE = "merchantCache";
    public static final int CACHE_TTL_SECONDS = 60;
    public static final int CACHE_MAX_SIZE = 10_000;

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(BENEFIT_CACHE, MERCHANT_CACHE);
        cacheManager.setCaffeine(caffeineCacheBuilder());
        return cacheManager;
    }

    private Caffeine<Object, Object> caffeineCacheBuilder() {
        return Caffeine.newBuilder()
                .expireAfterWrite(CACHE_TTL_SECONDS, TimeUnit.SECONDS)
                .maximumSize(CACHE_MAX_SIZE)
                .recordStats();
    }
}
