package com.benefitcoupon.application.service;

import com.benefitcoupon.application.dto.CouponResponse;
import com.benefitcoupon.application.dto.CouponStatsResponse;
import com.benefitcoupon.application.dto.CouponValidationResponse;
import com.benefitcoupon.application.dto.RedemptionResponse;
import com.benefitcoupon.application.event.CouponIssuedEvent;
import com.benefitcoupon.application.event.CouponRedeemedEvent;
import com.benefitcoupon.application.event.DomainEventPublisher;
import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.CouponStatus;
import com.benefitcoupon.domain.service.CouponLifecycleService;
import com.benefitcoupon.domain.service.IssueCommand;
import com.benefitcoupon.domain.service.QuotaGuard;
import com.benefitcoupon.domain.service.RedeemCommand;
import com.benefitcoupon.domain.service.Redemption;
import com.benefitcoupon.domain.service.Reservation;
import com.benefitcoupon.domain.vo.GeoPoint;
import com.benefitcoupon.dto.ResponseCode;
import com.benefitcoupon.exception.BusinessException;
import com.benefitcoupon.infrastructure.lock.DistributedLockExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 쿠폰 Application Facade 서비스
 *
 * 책임:
 * - 분산 락 관리 (같은 쿠폰 사용 요청 직렬화)
 * - 사용 커밋 이후 사용자 보유분 해제
 * - 이벤트 발행, DTO 변환
 *
 * 주의:
 * - 비즈니스 로직은 CouponLifecycleService에 위임
 * - 사용 처리 트랜잭션은 락 안에서 시작하고 끝남
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CouponService {

    private static final String LOCK_KEY_PREFIX_REDEEM = "lock:coupon:redeem:";

    private final CouponLifecycleService couponLifecycleService;
    private final QuotaGuard quotaGuard;
    private final DistributedLockExecutor lockExecutor;
    private final DomainEventPublisher eventPublisher;
    private final Clock clock;

    public CouponResponse issueCoupon(IssueCommand command) {
        Coupon coupon = couponLifecycleService.issue(command);
        publishAfterCommit(CouponIssuedEvent.from(coupon));
        return CouponResponse.from(coupon, clock.instant());
    }

    public RedemptionResponse redeemCoupon(RedeemCommand command) {
        String lockKey = LOCK_KEY_PREFIX_REDEEM + command.couponKey();

        Redemption redemption = lockExecutor.executeWithLock(lockKey,
                () -> couponLifecycleService.redeem(command));

        releaseUserHold(redemption.coupon());
        publishAfterCommit(CouponRedeemedEvent.of(redemption.coupon(), redemption.record()));
        return RedemptionResponse.from(redemption);
    }

    /**
     * 사용자 보유분은 쿠폰 만료 시각에 자동으로 풀리므로 실패해도 사용 결과는 유지합니다.
     */
    private void releaseUserHold(Coupon coupon) {
        try {
            quotaGuard.releaseUserHold(Reservation.heldBy(coupon));
        } catch (RuntimeException e) {
            log.warn("사용자 보유분 해제 실패, 만료 시 자동 해제: couponId={}, reservationId={}, error={}",
                    coupon.getId(), coupon.getReservationId(), e.getMessage());
        }
    }

    /**
     * 쿠폰 저장은 이미 끝났으므로 이벤트 발행 실패로 요청을 실패시키지 않습니다.
     */
    private void publishAfterCommit(Object event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.error("쿠폰 이벤트 발행 실패: event={}, error={}", event, e.getMessage(), e);
        }
    }

    public CouponValidationResponse validateCoupon(String token, Long merchantId, String location) {
        GeoPoint point = location == null || location.isBlank() ? null : GeoPoint.parse(location);
        return CouponValidationResponse.from(couponLifecycleService.validate(token, merchantId, point));
    }

    /**
     * @param status active | used | expired, null이면 전체
     */
    public List<CouponResponse> getUserCoupons(Long userId, String status) {
        Instant now = clock.instant();
        return couponLifecycleService.getUserCoupons(userId, toCouponStatus(status)).stream()
                .map(coupon -> CouponResponse.from(coupon, now))
                .toList();
    }

    public CouponStatsResponse getCouponStats(Long benefitId) {
        return CouponStatsResponse.of(benefitId, couponLifecycleService.getCouponStats(benefitId));
    }

    private static CouponStatus toCouponStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return CouponStatus.fromQueryValue(status);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ResponseCode.BAD_REQUEST, e.getMessage(), "InvalidStatus");
        }
    }
}
