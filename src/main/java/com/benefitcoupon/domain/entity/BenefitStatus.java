package com.benefitcoupon.domain.entity;

public enum BenefitStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    EXPIRED
}
