package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.entity.Coupon;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 발급 한도 예약
 *
 * 쿠폰 저장에 실패하면 반드시 {@link QuotaGuard#release(Reservation)}로 반환해야 합니다.
 *
 * @param reservationId 사용자 보유분을 식별하는 예약 ID
 * @param benefitId 혜택 ID
 * @param userId 사용자 ID
 * @param issueDate 일일 한도가 차감된 매장 현지 날짜
 * @param expireAt 사용자 보유분이 자동으로 풀리는 시각 (쿠폰 만료 시각)
 */
public record Reservation(String reservationId, Long benefitId, Long userId,
                          LocalDate issueDate, Instant expireAt) {

    /**
     * 발급된 쿠폰이 잡고 있는 사용자 보유분. 사용 후 {@link QuotaGuard#releaseUserHold(Reservation)}에만 씁니다.
     */
    public static Reservation heldBy(Coupon coupon) {
        return new Reservation(coupon.getReservationId(), coupon.getBenefitId(), coupon.getUserId(),
                null, coupon.getExpireAt());
    }
}
