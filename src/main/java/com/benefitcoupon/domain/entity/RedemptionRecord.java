package com.benefitcoupon.domain.entity;

import com.benefitcoupon.domain.entity.base.BaseEntity;
import com.benefitcoupon.domain.vo.GeoPoint;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 쿠폰 사용 기록 Entity
 *
 * 특정 쿠폰이 언제, 어느 매장에서, 어디서 사용되었는지 증명하는 감사 기록입니다.
 * 한 번 저장되면 수정/삭제하지 않으며 사용된 쿠폰과 1:1 관계입니다.
 */
@Entity
@Table(
    name = "coupon_redemptions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_redemption_coupon", columnNames = {"coupon_id"})
    },
    indexes = {
        @Index(name = "idx_redemption_merchant", columnList = "merchant_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RedemptionRecord extends BaseEntity {

    @Column(name = "coupon_id", nullable = false, updatable = false)
    private Long couponId;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Column(name = "redeemed_by", updatable = false)
    private Long redeemedBy;

    @Column(name = "location", length = 64, updatable = false)
    private GeoPoint location;

    @Column(name = "device_id", length = 100, updatable = false)
    private String deviceId;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "redeemed_at", nullable = false, updatable = false)
    private Instant redeemedAt;

    public RedemptionRecord(Long couponId, Long merchantId, Long redeemedBy, GeoPoint location,
                            String deviceId, String ipAddress, Instant redeemedAt) {
        if (couponId == null) {
            throw new IllegalArgumentException("쿠폰 ID는 필수입니다");
        }
        if (merchantId == null) {
            throw new IllegalArgumentException("가맹점 ID는 필수입니다");
        }
        if (redeemedAt == null) {
            throw new IllegalArgumentException("사용 시각은 필수입니다");
        }
        this.couponId = couponId;
        this.merchantId = merchantId;
        this.redeemedBy = redeemedBy;
        this.location = location;
        this.deviceId = deviceId;
        this.ipAddress = ipAddress;
        this.redeemedAt = redeemedAt;
    }
}
