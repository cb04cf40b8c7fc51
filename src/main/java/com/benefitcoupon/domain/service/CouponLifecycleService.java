package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.CouponStatus;
import com.benefitcoupon.domain.entity.Merchant;
import com.benefitcoupon.domain.entity.RedemptionRecord;
import com.benefitcoupon.domain.exception.CouponIssueException;
import com.benefitcoupon.domain.exception.CouponRedemptionException;
import com.benefitcoupon.domain.exception.IssueFailure;
import com.benefitcoupon.domain.exception.ValidationFailure;
import com.benefitcoupon.domain.repository.BenefitCatalog;
import com.benefitcoupon.domain.repository.CouponRepository;
import com.benefitcoupon.domain.repository.MerchantDirectory;
import com.benefitcoupon.domain.vo.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 쿠폰 생명주기 도메인 서비스
 *
 * 책임:
 * - 발급: 혜택 자격 확인 → 한도 예약 → 쿠폰 저장 (실패 시 예약 반환)
 * - 사용: 검증 파이프라인 → 조건부 사용 처리 → 사용 기록 추가 (단일 트랜잭션)
 * - 조회: 사용자 쿠폰 목록, 통계
 *
 * 상태 전이는 PENDING → REDEEMED, PENDING → EXPIRED 뿐이며 만료는 조회 시점에 계산합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CouponLifecycleService {

    private final CouponRepository couponRepository;
    private final BenefitCatalog benefitCatalog;
    private final MerchantDirectory merchantDirectory;
    private final QuotaGuard quotaGuard;
    private final TokenIssuer tokenIssuer;
    private final ValidationPipeline validationPipeline;
    private final RedemptionRecorder redemptionRecorder;
    private final Clock clock;

    /**
     * 쿠폰을 발급합니다.
     *
     * 한도 예약 이후 단계가 실패하면 예약을 반환하고 예외를 다시 던집니다.
     * 쿠폰 저장이 예외 처리 전에 커밋되어야 하므로 트랜잭션을 걸지 않습니다.
     *
     * @throws CouponIssueException 혜택 자격 미충족
     * @throws com.benefitcoupon.domain.exception.QuotaExceededException 한도 초과
     */
    public Coupon issue(IssueCommand command) {
        Instant now = clock.instant();
        Benefit benefit = benefitCatalog.findById(command.benefitId())
                .orElseThrow(() -> new CouponIssueException(IssueFailure.BENEFIT_NOT_FOUND));

        validateEligibility(benefit, command, now);

        Instant expireAt = now.plus(Coupon.VALIDITY);
        Reservation reservation = quotaGuard.reserve(benefit, command.userId(), now, expireAt);

        try {
            ensureNoDuplicateActiveCoupon(benefit, command.userId(), now);

            Coupon coupon = new Coupon(
                    benefit.getId(),
                    command.userId(),
                    tokenIssuer.newToken(),
                    tokenIssuer.newPin(),
                    reservation.reservationId(),
                    now,
                    command.metadata()
            );
            Coupon saved = couponRepository.save(coupon);

            log.info("쿠폰 발급 완료: couponId={}, benefitId={}, userId={}, expireAt={}",
                    saved.getId(), benefit.getId(), command.userId(), saved.getExpireAt());
            return saved;
        } catch (RuntimeException e) {
            releaseQuietly(reservation, e);
            throw e;
        }
    }

    /**
     * 반환 실패가 원래 발급 실패를 가리지 않도록 suppressed로 붙입니다.
     * 반환되지 않은 사용자 보유분은 쿠폰 만료 시각에 풀립니다.
     */
    private void releaseQuietly(Reservation reservation, RuntimeException cause) {
        try {
            quotaGuard.release(reservation);
        } catch (RuntimeException releaseFailure) {
            log.warn("발급 한도 예약 반환 실패: benefitId={}, userId={}, reservationId={}, error={}",
                    reservation.benefitId(), reservation.userId(), reservation.reservationId(),
                    releaseFailure.getMessage());
            cause.addSuppressed(releaseFailure);
        }
    }

    private void validateEligibility(Benefit benefit, IssueCommand command, Instant now) {
        if (!benefit.isActive()) {
            throw new CouponIssueException(IssueFailure.BENEFIT_INACTIVE);
        }
        if (!benefit.isValidAt(now)) {
            throw new CouponIssueException(IssueFailure.OUT_OF_VALIDITY_WINDOW);
        }
        if (benefit.isStudentOnly() && !command.student()) {
            throw new CouponIssueException(IssueFailure.STUDENT_ONLY);
        }
    }

    /**
     * 원장 기준 교차 확인. 정상이라면 한도 예약 단계에서 이미 걸러집니다.
     */
    private void ensureNoDuplicateActiveCoupon(Benefit benefit, Long userId, Instant now) {
        int userLimit = benefit.getQuotaRule().getUserLimit();
        long pending = couponRepository.countPendingByBenefitIdAndUserId(benefit.getId(), userId, now);
        if (pending >= userLimit) {
            log.warn("한도 예약과 원장 불일치, 사용 가능한 쿠폰 보유 중: benefitId={}, userId={}, pending={}",
                    benefit.getId(), userId, pending);
            throw new CouponIssueException(IssueFailure.DUPLICATE_ACTIVE_COUPON);
        }
    }

    /**
     * 쿠폰을 사용 처리합니다.
     *
     * 검증, 조건부 사용 처리, 사용 기록 추가가 하나의 트랜잭션으로 묶입니다.
     * 동시 요청 중 조건부 UPDATE에 성공한 하나만 사용 처리됩니다.
     *
     * @throws CouponRedemptionException 검증 실패 또는 이미 사용된 쿠폰
     */
    @Transactional
    public Redemption redeem(RedeemCommand command) {
        Instant now = clock.instant();
        Coupon coupon = resolveCoupon(command, now);

        ValidationResult result = runPipeline(coupon, command.merchantId(), command.location(), now);
        if (!result.valid()) {
            log.info("쿠폰 사용 거절: reason={}, merchantId={}, couponId={}",
                    result.reason(), command.merchantId(), coupon != null ? coupon.getId() : null);
            throw new CouponRedemptionException(result.failure(), result.message());
        }

        if (!couponRepository.markRedeemedIfPending(coupon.getId(), now)) {
            log.info("동시 사용 요청으로 이미 사용 처리됨: couponId={}", coupon.getId());
            throw new CouponRedemptionException(ValidationFailure.ALREADY_REDEEMED);
        }

        Coupon redeemed = couponRepository.getByIdOrThrow(coupon.getId());
        RedemptionRecord record = redemptionRecorder.append(redeemed, command, now);

        log.info("쿠폰 사용 완료: couponId={}, benefitId={}, merchantId={}, redeemedBy={}",
                redeemed.getId(), redeemed.getBenefitId(), command.merchantId(), command.redeemedBy());
        return new Redemption(redeemed, record);
    }

    /**
     * 사용 가능 여부만 확인합니다. 상태를 바꾸지 않습니다.
     */
    @Transactional(readOnly = true)
    public ValidationResult validate(String token, Long merchantId, GeoPoint location) {
        Instant now = clock.instant();
        Coupon coupon = couponRepository.findByToken(token).orElse(null);
        return runPipeline(coupon, merchantId, location, now);
    }

    private ValidationResult runPipeline(Coupon coupon, Long merchantId, GeoPoint location, Instant now) {
        Benefit benefit = coupon == null
                ? null
                : benefitCatalog.findById(coupon.getBenefitId()).orElse(null);
        Merchant merchant = merchantId == null
                ? null
                : merchantDirectory.findById(merchantId).orElse(null);

        if (benefit != null && benefit.requiresGeofence() && location == null) {
            log.info("위치 정보 없이 지오펜스 혜택 검증: benefitId={}, merchantId={}", benefit.getId(), merchantId);
        }

        return validationPipeline.run(new ValidationInput(coupon, benefit, merchant, merchantId, location, now));
    }

    /**
     * 토큰이 있으면 토큰으로, 없으면 가맹점 혜택 범위 안에서 PIN으로 찾습니다.
     * 토큰으로 찾지 못하면 null을 반환해 파이프라인이 NotFound로 판정하게 합니다.
     */
    private Coupon resolveCoupon(RedeemCommand command, Instant now) {
        if (command.hasToken()) {
            return couponRepository.findByToken(command.token()).orElse(null);
        }
        if (!command.hasPin()) {
            throw new CouponRedemptionException(ValidationFailure.NOT_FOUND);
        }

        List<Long> benefitIds = benefitCatalog.findIdsByMerchantId(command.merchantId());
        List<Coupon> candidates = couponRepository.findPendingByPin(command.pin(), benefitIds, now);
        if (candidates.size() != 1) {
            log.warn("PIN으로 쿠폰을 특정할 수 없음: merchantId={}, matches={}",
                    command.merchantId(), candidates.size());
            throw new CouponRedemptionException(ValidationFailure.AMBIGUOUS_OR_NOT_FOUND);
        }
        return candidates.get(0);
    }

    /**
     * 사용자 쿠폰 목록 (최신 발급순)
     *
     * @param status null이면 전체
     */
    @Transactional(readOnly = true)
    public List<Coupon> getUserCoupons(Long userId, CouponStatus status) {
        if (status == null) {
            return couponRepository.findByUserId(userId);
        }
        Instant now = clock.instant();
        return switch (status) {
            case PENDING -> couponRepository.findPendingByUserId(userId, now);
            case REDEEMED -> couponRepository.findRedeemedByUserId(userId);
            case EXPIRED -> couponRepository.findExpiredByUserId(userId, now);
        };
    }

    /**
     * @param benefitId null이면 전체 혜택
     */
    @Transactional(readOnly = true)
    public CouponStats getCouponStats(Long benefitId) {
        Instant now = clock.instant();
        return CouponStats.of(
                couponRepository.countIssued(benefitId),
                couponRepository.countRedeemed(benefitId),
                couponRepository.countPending(benefitId, now),
                couponRepository.countExpired(benefitId, now)
        );
    }
}
