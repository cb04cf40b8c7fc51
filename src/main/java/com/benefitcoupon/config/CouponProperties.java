package com.benefitcoupon.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.ZoneId;

/**
 * 쿠폰 엔진 설정
 *
 * application.yml의 coupon.* 값을 읽어옴
 */
@Getter
@ConfigurationProperties(prefix = "coupon")
public class CouponProperties {

    /**
     * 시간대/사용 불가일/일일 한도 판정 기준 시간대
     */
    private final ZoneId zoneId;

    /**
     * 쿠폰 사용 락 획득 대기 시간 (초)
     */
    private final long lockWaitSeconds;

    /**
     * 쿠폰 사용 락 유지 시간 (초)
     */
    private final long lockLeaseSeconds;

    public CouponProperties(@DefaultValue("Asia/Seoul") ZoneId zoneId,
                            @DefaultValue("3") long lockWaitSeconds,
                            @DefaultValue("5") long lockLeaseSeconds) {
        this.zoneId = zoneId;
        this.lockWaitSeconds = lockWaitSeconds;
        this.lockLeaseSeconds = lockLeaseSeconds;
    }
}
