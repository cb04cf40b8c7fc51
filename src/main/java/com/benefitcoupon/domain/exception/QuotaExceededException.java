package com.benefitcoupon.domain.exception;

import com.benefitcoupon.domain.service.QuotaScope;

/**
 * 발급 한도 초과 예외
 */
public class QuotaExceededException extends RuntimeException {

    private final QuotaScope scope;

    public QuotaExceededException(QuotaScope scope) {
        super("발급 한도를 초과했습니다: " + scope.getValue());
        this.scope = scope;
    }

    public QuotaScope getScope() {
        return scope;
    }

    public String getReason() {
        return "QuotaExceeded(" + scope.getValue() + ")";
    }
}
