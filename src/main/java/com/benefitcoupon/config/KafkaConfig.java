package com.benefitcoupon.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
@Profile("kafka")
public class KafkaConfig {

    public static final String TOPIC_COUPON_ISSUED = "coupon-issued";
    public static final String TOPIC_COUPON_REDEEMED = "coupon-redeemed";

    @Bean
    public NewTopic couponIssuedTopic() {
        return TopicBuilder.name(TOPIC_COUPON_ISSUED)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic couponRedeemedTopic() {
        return TopicBuilder.name(TOPIC_COUPON_REDEEMED)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
