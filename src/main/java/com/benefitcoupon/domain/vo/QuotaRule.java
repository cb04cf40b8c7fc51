package com.benefitcoupon.domain.vo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 혜택별 발급 한도 규칙
 *
 * null 한도는 무제한을 의미합니다. 사용자 한도는 기본 1장이며,
 * 만료되거나 사용된 쿠폰은 사용자 한도에서 제외됩니다.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class QuotaRule {

    public static final int DEFAULT_USER_LIMIT = 1;

    @Column(name = "total_limit")
    private Integer totalLimit;

    @Column(name = "daily_limit")
    private Integer dailyLimit;

    @Column(name = "user_limit")
    private Integer userLimit;

    private QuotaRule(Integer totalLimit, Integer dailyLimit, Integer userLimit) {
        validateLimit(totalLimit, "총 발급 한도");
        validateLimit(dailyLimit, "일일 발급 한도");
        validateLimit(userLimit, "사용자별 발급 한도");
        this.totalLimit = totalLimit;
        this.dailyLimit = dailyLimit;
        this.userLimit = userLimit;
    }

    public static QuotaRule of(Integer totalLimit, Integer dailyLimit, Integer userLimit) {
        return new QuotaRule(totalLimit, dailyLimit, userLimit);
    }

    /**
     * 총/일일 한도 없음, 사용자당 1장
     */
    public static QuotaRule defaults() {
        return new QuotaRule(null, null, DEFAULT_USER_LIMIT);
    }

    /**
     * 사용자 한도가 저장되지 않은 혜택은 기본 1장
     */
    public int getUserLimit() {
        return userLimit != null ? userLimit : DEFAULT_USER_LIMIT;
    }

    private static void validateLimit(Integer limit, String name) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException(name + "는 0 이상이어야 합니다");
        }
    }
}
