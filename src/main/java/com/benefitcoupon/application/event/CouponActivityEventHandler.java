package com.benefitcoupon.application.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 쿠폰 활동 기록 이벤트 핸들러
 *
 * 발급/사용 활동을 비동기로 기록한다. 요청 처리 결과에는 영향을 주지 않는다.
 * kafka 프로파일에서는 이벤트가 토픽으로 발행되므로 등록되지 않는다.
 */
@Slf4j
@Component
@Profile("!kafka")
public class CouponActivityEventHandler {

    @Async("eventExecutor")
    @EventListener
    public void handle(CouponIssuedEvent event) {
        log.info("activity=coupon_issued couponId={} benefitId={} userId={} deviceId={} expireAt={}",
                event.couponId(), event.benefitId(), event.userId(), event.deviceId(), event.expireAt());
    }

    @Async("eventExecutor")
    @EventListener
    public void handle(CouponRedeemedEvent event) {
        log.info("activity=coupon_redeemed couponId={} benefitId={} merchantId={} redeemedBy={} location={}",
                event.couponId(), event.benefitId(), event.merchantId(), event.redeemedBy(), event.location());
    }
}
