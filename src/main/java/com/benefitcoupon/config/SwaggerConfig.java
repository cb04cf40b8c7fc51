package com.benefitcoupon.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Benefit Coupon API")
                        .description("제휴 혜택 쿠폰 발급/사용 API 문서")
                        .version("v1.0.0"));
    }
}
