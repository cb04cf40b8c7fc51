package com.benefitcoupon.domain.service;

/**
 * 발급 한도 범위
 */
public enum QuotaScope {

    TOTAL("total"),
    DAILY("daily"),
    USER("user");

    private final String value;

    QuotaScope(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
