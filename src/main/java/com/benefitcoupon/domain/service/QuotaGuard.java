package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.exception.QuotaExceededException;

import java.time.Instant;

/**
 * 발급 한도 관리자
 *
 * 총/일일/사용자별 한도 확인과 차감은 하나의 원자적 연산이어야 합니다.
 * 호출자가 카운터를 직접 읽고 쓰는 일은 없습니다.
 */
public interface QuotaGuard {

    /**
     * 한도를 확인하고 예약합니다.
     *
     * @param benefit 혜택 (한도 규칙 포함)
     * @param userId 사용자 ID
     * @param issuedAt 발급 시각 (일일 한도 날짜 계산 기준)
     * @param expireAt 사용자 보유분 만료 시각
     * @return 예약 정보
     * @throws QuotaExceededException 한도 초과 시
     */
    Reservation reserve(Benefit benefit, Long userId, Instant issuedAt, Instant expireAt);

    /**
     * 예약을 완전히 되돌립니다. 같은 예약을 여러 번 반환해도 한 번만 반영됩니다.
     */
    void release(Reservation reservation);

    /**
     * 쿠폰 사용 후 사용자 보유분만 해제합니다. 총/일일 발급 수는 유지됩니다.
     */
    void releaseUserHold(Reservation reservation);
}
