package com.benefitcoupon.domain.vo;

/**
 * 쿠폰 발급 요청 단말 정보
 */
public record IssueMetadata(String deviceId, String userAgent, String ipAddress) {

    public static IssueMetadata empty() {
        return new IssueMetadata(null, null, null);
    }
}
