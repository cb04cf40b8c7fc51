package com.benefitcoupon.application.event;

/**
 * 도메인 이벤트 발행 추상화 인터페이스
 *
 * 기본 프로파일은 Spring Event, kafka 프로파일은 Kafka 토픽으로 발행한다.
 */
public interface DomainEventPublisher {

    void publish(Object event);
}
