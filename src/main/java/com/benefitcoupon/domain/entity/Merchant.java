package com.benefitcoupon.domain.entity;

import com.benefitcoupon.domain.entity.base.BaseEntity;
import com.benefitcoupon.domain.vo.GeoPoint;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 가맹점 Entity (가맹점 디렉터리 소유, 읽기 전용)
 */
@Entity
@Table(name = "merchants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Merchant extends BaseEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MerchantStatus status;

    @Column(name = "location", length = 64)
    private GeoPoint location;

    public Merchant(String name, GeoPoint location) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("가맹점 이름은 필수입니다");
        }
        this.name = name;
        this.location = location;
        this.status = MerchantStatus.ACTIVE;
    }

    public boolean hasLocation() {
        return location != null;
    }
}
