package com.benefitcoupon.domain.vo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 사용 불가일 (매장 현지 날짜 기준)
 */
@Embeddable
@Getter
@EqualsAndHashCode(of = "date")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BlackoutDate {

    @Column(name = "blackout_date", nullable = false)
    private LocalDate date;

    @Column(name = "reason", length = 100)
    private String reason;

    private BlackoutDate(LocalDate date, String reason) {
        if (date == null) {
            throw new IllegalArgumentException("사용 불가일은 필수입니다");
        }
        this.date = date;
        this.reason = reason;
    }

    public static BlackoutDate of(LocalDate date) {
        return new BlackoutDate(date, null);
    }

    public static BlackoutDate of(LocalDate date, String reason) {
        return new BlackoutDate(date, reason);
    }
}
