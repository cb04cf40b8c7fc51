package com.benefitcoupon.domain.exception;

/**
 * 쿠폰 발급 거절 예외
 */
public class CouponIssueException extends RuntimeException {

    private final IssueFailure failure;

    public CouponIssueException(IssueFailure failure) {
        super(failure.getMessage());
        this.failure = failure;
    }

    public IssueFailure getFailure() {
        return failure;
    }
}
