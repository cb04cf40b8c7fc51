package com.benefitcoupon.infrastructure.kafka;

import com.benefitcoupon.application.event.CouponIssuedEvent;
import com.benefitcoupon.application.event.CouponRedeemedEvent;
import com.benefitcoupon.application.event.DomainEventPublisher;
import com.benefitcoupon.config.KafkaConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Kafka 기반 도메인 이벤트 발행
 *
 * Key 설계: benefitId
 * - 같은 혜택의 발급/사용 이벤트가 같은 파티션으로 들어가 순서가 보장된다.
 */
@Slf4j
@Component
@Profile("kafka")
@RequiredArgsConstructor
public class KafkaEventPublisher implements DomainEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(Object event) {
        if (event instanceof CouponIssuedEvent e) {
            send(KafkaConfig.TOPIC_COUPON_ISSUED, e.benefitId().toString(), e);
        } else if (event instanceof CouponRedeemedEvent e) {
            send(KafkaConfig.TOPIC_COUPON_REDEEMED, e.benefitId().toString(), e);
        } else {
            log.warn("Unknown event type: {}", event.getClass().getName());
        }
    }

    private void send(String topic, String key, Object event) {
        kafkaTemplate.send(topic, key, event).whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Kafka 메시지 발행 성공: topic={}, key={}, offset={}",
                        topic, key, result.getRecordMetadata().offset());
            } else {
                log.error("Kafka 메시지 발행 실패: topic={}, key={}, error={}",
                        topic, key, ex.getMessage());
            }
        });
    }
}
