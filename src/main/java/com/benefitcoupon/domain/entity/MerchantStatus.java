package com.benefitcoupon.domain.entity;

public enum MerchantStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED
}
