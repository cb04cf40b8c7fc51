package com.benefitcoupon.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * 쿠폰 사용 요청. token 또는 pin 중 하나는 있어야 합니다.
 */
public record CouponRedeemRequest(
    String token,

    @NotNull(message = "가맹점 ID는 필수입니다")
    @Positive(message = "가맹점 ID는 양수여야 합니다")
    Long merchantId,

    @Valid
    LocationRequest location,

    @Pattern(regexp = "\\d{4}", message = "PIN은 4자리 숫자여야 합니다")
    String pin
) {

    @JsonIgnore
    @AssertTrue(message = "token 또는 pin 중 하나는 필수입니다")
    public boolean isTokenOrPinPresent() {
        return (token != null && !token.isBlank()) || (pin != null && !pin.isBlank());
    }
}
