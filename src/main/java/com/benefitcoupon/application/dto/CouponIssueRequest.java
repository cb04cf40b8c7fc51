package com.benefitcoupon.application.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CouponIssueRequest(
    @NotNull(message = "혜택 ID는 필수입니다")
    @Positive(message = "혜택 ID는 양수여야 합니다")
    Long benefitId
) {}
