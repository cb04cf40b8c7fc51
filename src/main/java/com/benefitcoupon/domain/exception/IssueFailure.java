package com.benefitcoupon.domain.exception;

/**
 * 발급 단계 실패 사유 (한도 초과 제외)
 */
public enum IssueFailure {

    BENEFIT_NOT_FOUND("BenefitNotFound", "혜택을 찾을 수 없습니다"),
    BENEFIT_INACTIVE("BenefitInactive", "진행 중인 혜택이 아닙니다"),
    OUT_OF_VALIDITY_WINDOW("OutOfValidityWindow", "혜택 유효 기간이 아닙니다"),
    STUDENT_ONLY("StudentOnly", "학생 인증 사용자만 받을 수 있는 혜택입니다"),
    DUPLICATE_ACTIVE_COUPON("DuplicateActiveCoupon", "이미 사용 가능한 쿠폰을 보유하고 있습니다");

    private final String reason;
    private final String message;

    IssueFailure(String reason, String message) {
        this.reason = reason;
        this.message = message;
    }

    public String getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }
}
