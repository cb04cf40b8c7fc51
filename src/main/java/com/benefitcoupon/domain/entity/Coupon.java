package com.benefitcoupon.domain.entity;

import com.benefitcoupon.domain.entity.base.BaseEntity;
import com.benefitcoupon.domain.vo.IssueMetadata;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 발급 쿠폰 Entity
 *
 * 상태 컬럼을 두지 않습니다. 상태는 항상 redeemedAt, expireAt, 현재 시각으로 계산합니다.
 * redeemedAt은 조건부 UPDATE(redeemed_at IS NULL)로만 기록됩니다.
 */
@Entity
@Table(
    name = "coupons",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_coupon_token", columnNames = {"token"})
    },
    indexes = {
        @Index(name = "idx_coupon_user", columnList = "user_id"),
        @Index(name = "idx_coupon_benefit", columnList = "benefit_id"),
        @Index(name = "idx_coupon_pin", columnList = "pin"),
        @Index(name = "idx_coupon_expire", columnList = "expire_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Coupon extends BaseEntity {

    public static final Duration VALIDITY = Duration.ofMinutes(10);

    @Column(name = "benefit_id", nullable = false)
    private Long benefitId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token", nullable = false, length = 36)
    private String token;

    @Column(name = "pin", nullable = false, length = 4)
    private String pin;

    @Column(name = "reservation_id", nullable = false, length = 36)
    private String reservationId;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "expire_at", nullable = false, updatable = false)
    private Instant expireAt;

    @Column(name = "redeemed_at")
    private Instant redeemedAt;

    @Column(name = "device_id", length = 100)
    private String deviceId;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    public Coupon(Long benefitId, Long userId, String token, String pin, String reservationId,
                  Instant issuedAt, IssueMetadata metadata) {
        validateConstructorParams(benefitId, userId, token, pin, reservationId, issuedAt);

        this.benefitId = benefitId;
        this.userId = userId;
        this.token = token;
        this.pin = pin;
        this.reservationId = reservationId;
        this.issuedAt = issuedAt;
        this.expireAt = issuedAt.plus(VALIDITY);
        if (metadata != null) {
            this.deviceId = metadata.deviceId();
            this.userAgent = metadata.userAgent();
            this.ipAddress = metadata.ipAddress();
        }
    }

    private void validateConstructorParams(Long benefitId, Long userId, String token, String pin,
                                           String reservationId, Instant issuedAt) {
        if (benefitId == null) {
            throw new IllegalArgumentException("혜택 ID는 필수입니다");
        }
        if (userId == null) {
            throw new IllegalArgumentException("사용자 ID는 필수입니다");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("토큰은 필수입니다");
        }
        if (pin == null || !pin.matches("\\d{4}")) {
            throw new IllegalArgumentException("PIN은 4자리 숫자여야 합니다");
        }
        if (reservationId == null || reservationId.isBlank()) {
            throw new IllegalArgumentException("발급 예약 ID는 필수입니다");
        }
        if (issuedAt == null) {
            throw new IllegalArgumentException("발급 시각은 필수입니다");
        }
    }

    /**
     * 현재 시각 기준 상태. 세 상태 중 정확히 하나를 반환합니다.
     */
    public CouponStatus statusAt(Instant now) {
        if (redeemedAt != null) {
            return CouponStatus.REDEEMED;
        }
        if (now.isAfter(expireAt)) {
            return CouponStatus.EXPIRED;
        }
        return CouponStatus.PENDING;
    }

    public boolean isRedeemed() {
        return redeemedAt != null;
    }

    public boolean isExpiredAt(Instant now) {
        return statusAt(now) == CouponStatus.EXPIRED;
    }

    public boolean isPendingAt(Instant now) {
        return statusAt(now) == CouponStatus.PENDING;
    }
}
