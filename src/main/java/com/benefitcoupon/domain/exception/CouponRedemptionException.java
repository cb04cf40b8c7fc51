package com.benefitcoupon.domain.exception;

/**
 * 쿠폰 사용 거절 예외
 */
public class CouponRedemptionException extends RuntimeException {

    private final ValidationFailure failure;

    public CouponRedemptionException(ValidationFailure failure) {
        this(failure, failure.getMessage());
    }

    public CouponRedemptionException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }
}
