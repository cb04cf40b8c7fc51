package com.benefitcoupon.domain.vo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 요일/시간대 사용 가능 구간
 *
 * 시작 시각은 포함, 종료 시각은 제외합니다.
 * 종료 시각이 시작 시각보다 이르거나 같으면 다음 날로 넘어가는 구간입니다 (예: 금 22:00 ~ 02:00).
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TimeWindow {

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    private TimeWindow(DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime) {
        if (dayOfWeek == null) {
            throw new IllegalArgumentException("요일은 필수입니다");
        }
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("시작/종료 시각은 필수입니다");
        }
        this.dayOfWeek = dayOfWeek;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public static TimeWindow of(DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime) {
        return new TimeWindow(dayOfWeek, startTime, endTime);
    }

    public boolean crossesMidnight() {
        return !endTime.isAfter(startTime);
    }

    /**
     * 매장 현지 시각이 이 구간에 포함되는지 확인합니다.
     */
    public boolean contains(LocalDateTime localDateTime) {
        DayOfWeek day = localDateTime.getDayOfWeek();
        LocalTime time = localDateTime.toLocalTime();

        if (!crossesMidnight()) {
            return day == dayOfWeek && !time.isBefore(startTime) && time.isBefore(endTime);
        }
        boolean lateOnStartDay = day == dayOfWeek && !time.isBefore(startTime);
        boolean earlyOnNextDay = day == dayOfWeek.plus(1) && time.isBefore(endTime);
        return lateOnStartDay || earlyOnNextDay;
    }
}
