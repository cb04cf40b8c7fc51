package com.benefitcoupon.domain.service;

import java.util.Optional;

/**
 * 검증 파이프라인의 단일 단계
 */
@FunctionalInterface
interface RedemptionCheck {

    /**
     * @return 실패하면 실패 결과, 통과하면 empty
     */
    Optional<ValidationResult> check(ValidationInput input);
}
