package com.benefitcoupon.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 설정 (쿠폰 사용 분산 락)
 *
 * 발급 한도 스크립트는 Spring Data Redis의 StringRedisTemplate을 사용합니다.
 */
@Configuration
public class RedisConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        String password = redisProperties.getPassword();
        config.useSingleServer()
                .setAddress("redis://" + redisProperties.getHost() + ":" + redisProperties.getPort())
                .setPassword(password != null && !password.isEmpty() ? password : null);

        return Redisson.create(config);
    }
}
