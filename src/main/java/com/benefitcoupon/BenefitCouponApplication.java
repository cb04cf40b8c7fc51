package com.benefitcoupon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BenefitCouponApplication {

    public static void main(String[] args) {
        SpringApplication.run(BenefitCouponApplication.class, args);
    }
}
