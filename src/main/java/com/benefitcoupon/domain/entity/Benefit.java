package com.benefitcoupon.domain.entity;

import com.benefitcoupon.domain.entity.base.BaseEntity;
import com.benefitcoupon.domain.vo.BlackoutDate;
import com.benefitcoupon.domain.vo.QuotaRule;
import com.benefitcoupon.domain.vo.TimeWindow;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 가맹점 혜택 Entity
 *
 * 혜택 카탈로그가 소유하며 이 엔진에서는 읽기 전용으로 사용합니다.
 * 발급 한도, 사용 가능 시간대, 사용 불가일 규칙을 타입이 있는 하위 구조로 가집니다.
 */
@Entity
@Table(name = "benefits")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Benefit extends BaseEntity {

    public static final int DEFAULT_GEO_RADIUS_METERS = 150;
    public static final int MAX_GEO_RADIUS_METERS = 1000;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BenefitStatus status;

    @Column(name = "valid_from", nullable = false)
    private Instant validFrom;

    @Column(name = "valid_to", nullable = false)
    private Instant validTo;

    @Column(name = "geo_radius_m", nullable = false)
    private int geoRadiusMeters;

    @Column(name = "student_only", nullable = false)
    private boolean studentOnly;

    @Embedded
    private QuotaRule quotaRule;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "benefit_time_windows", joinColumns = @JoinColumn(name = "benefit_id"))
    private Set<TimeWindow> timeWindows = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "benefit_blackouts", joinColumns = @JoinColumn(name = "benefit_id"))
    private Set<BlackoutDate> blackoutDates = new HashSet<>();

    public Benefit(Long merchantId, String title, Instant validFrom, Instant validTo,
                   int geoRadiusMeters, QuotaRule quotaRule, boolean studentOnly) {
        validateConstructorParams(merchantId, title, validFrom, validTo, geoRadiusMeters);

        this.merchantId = merchantId;
        this.title = title;
        this.validFrom = validFrom;
        this.validTo = validTo;
        this.geoRadiusMeters = geoRadiusMeters;
        this.quotaRule = quotaRule != null ? quotaRule : QuotaRule.defaults();
        this.studentOnly = studentOnly;
        this.status = BenefitStatus.ACTIVE;
    }

    private void validateConstructorParams(Long merchantId, String title, Instant validFrom,
                                           Instant validTo, int geoRadiusMeters) {
        if (merchantId == null) {
            throw new IllegalArgumentException("가맹점 ID는 필수입니다");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("혜택 제목은 필수입니다");
        }
        if (validFrom == null || validTo == null) {
            throw new IllegalArgumentException("유효 기간은 필수입니다");
        }
        if (!validFrom.isBefore(validTo)) {
            throw new IllegalArgumentException("유효 시작일은 종료일보다 이전이어야 합니다");
        }
        if (geoRadiusMeters < 0 || geoRadiusMeters > MAX_GEO_RADIUS_METERS) {
            throw new IllegalArgumentException("지오펜스 반경은 0 ~ 1000m 범위여야 합니다");
        }
    }

    /**
     * 한도 컬럼이 모두 NULL이면 JPA가 임베디드 값을 null로 읽으므로 기본 규칙으로 대신합니다.
     */
    public QuotaRule getQuotaRule() {
        return quotaRule != null ? quotaRule : QuotaRule.defaults();
    }

    public boolean isActive() {
        return status == BenefitStatus.ACTIVE;
    }

    public boolean isValidAt(Instant now) {
        return !now.isBefore(validFrom) && !now.isAfter(validTo);
    }

    public boolean requiresGeofence() {
        return geoRadiusMeters > 0;
    }

    /**
     * 시간대 규칙이 없으면 항상 사용 가능합니다.
     */
    public boolean isWithinTimeWindows(LocalDateTime localNow) {
        if (timeWindows.isEmpty()) {
            return true;
        }
        return timeWindows.stream().anyMatch(window -> window.contains(localNow));
    }

    public boolean isBlackout(LocalDate localDate) {
        return blackoutDates.stream().anyMatch(blackout -> blackout.getDate().equals(localDate));
    }

    public Set<TimeWindow> getTimeWindows() {
        return Collections.unmodifiableSet(timeWindows);
    }

    public Set<BlackoutDate> getBlackoutDates() {
        return Collections.unmodifiableSet(blackoutDates);
    }

    public void addTimeWindow(TimeWindow timeWindow) {
        this.timeWindows.add(timeWindow);
    }

    public void addBlackoutDate(BlackoutDate blackoutDate) {
        this.blackoutDates.add(blackoutDate);
    }

    public void updateStatus(BenefitStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("상태는 필수입니다");
        }
        this.status = status;
    }
}
