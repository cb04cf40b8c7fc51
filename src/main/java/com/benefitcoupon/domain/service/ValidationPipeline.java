package com.benefitcoupon.domain.service;

import com.benefitcoupon.config.CouponProperties;
import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.Merchant;
import com.benefitcoupon.domain.exception.ValidationFailure;
import com.benefitcoupon.domain.vo.GeofenceResult;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * 쿠폰 사용 검증 파이프라인
 *
 * 존재 → 미사용 → 미만료 → 혜택 존재 → 가맹점 일치 → 지오펜스 → 시간대 → 사용 불가일
 * 순서로 검사하고 첫 번째 실패에서 멈춥니다.
 *
 * 입력(쿠폰, 혜택, 가맹점, 위치, 시각)만으로 결과가 결정되며 부수 효과가 없습니다.
 * 따라서 조회용 검증과 사용 트랜잭션 내부 검증에서 두 번 실행해도 안전합니다.
 */
@Component
public class ValidationPipeline {

    private final ZoneId zoneId;
    private final List<RedemptionCheck> checks;

    public ValidationPipeline(CouponProperties couponProperties) {
        this.zoneId = couponProperties.getZoneId();
        this.checks = List.of(
                this::checkExists,
                this::checkNotRedeemed,
                this::checkNotExpired,
                this::checkBenefitExists,
                this::checkMerchantMatches,
                this::checkGeofence,
                this::checkTimeWindow,
                this::checkBlackout
        );
    }

    public ValidationResult run(ValidationInput input) {
        for (RedemptionCheck check : checks) {
            Optional<ValidationResult> failure = check.check(input);
            if (failure.isPresent()) {
                return failure.get();
            }
        }
        return ValidationResult.valid(input.coupon());
    }

    private Optional<ValidationResult> checkExists(ValidationInput input) {
        return fail(input.coupon() == null, ValidationFailure.NOT_FOUND);
    }

    private Optional<ValidationResult> checkNotRedeemed(ValidationInput input) {
        return fail(input.coupon().isRedeemed(), ValidationFailure.ALREADY_REDEEMED);
    }

    private Optional<ValidationResult> checkNotExpired(ValidationInput input) {
        return fail(input.coupon().isExpiredAt(input.now()), ValidationFailure.EXPIRED);
    }

    private Optional<ValidationResult> checkBenefitExists(ValidationInput input) {
        Coupon coupon = input.coupon();
        Benefit benefit = input.benefit();
        return fail(benefit == null || !benefit.getId().equals(coupon.getBenefitId()),
                ValidationFailure.BENEFIT_MISSING);
    }

    private Optional<ValidationResult> checkMerchantMatches(ValidationInput input) {
        return fail(!input.benefit().getMerchantId().equals(input.requestedMerchantId()),
                ValidationFailure.MERCHANT_MISMATCH);
    }

    /**
     * 위치가 전달되지 않으면 건너뜁니다.
     */
    private Optional<ValidationResult> checkGeofence(ValidationInput input) {
        Benefit benefit = input.benefit();
        if (!benefit.requiresGeofence() || input.location() == null) {
            return Optional.empty();
        }

        Merchant merchant = input.merchant();
        if (merchant == null || !merchant.hasLocation()) {
            return Optional.of(ValidationResult.invalid(ValidationFailure.MERCHANT_LOCATION_UNKNOWN));
        }

        GeofenceResult geofence = GeoMath.withinRadius(
                input.location(), merchant.getLocation(), benefit.getGeoRadiusMeters());
        if (geofence.within()) {
            return Optional.empty();
        }

        String message = String.format("매장 반경 %dm 이내에서만 사용할 수 있습니다 (현재 거리: %s)",
                benefit.getGeoRadiusMeters(), geofence.distanceFormatted());
        return Optional.of(ValidationResult.outOfGeofence(message, geofence.distanceFormatted()));
    }

    private Optional<ValidationResult> checkTimeWindow(ValidationInput input) {
        LocalDateTime localNow = LocalDateTime.ofInstant(input.now(), zoneId);
        return fail(!input.benefit().isWithinTimeWindows(localNow), ValidationFailure.OUTSIDE_TIME_WINDOW);
    }

    private Optional<ValidationResult> checkBlackout(ValidationInput input) {
        LocalDateTime localNow = LocalDateTime.ofInstant(input.now(), zoneId);
        return fail(input.benefit().isBlackout(localNow.toLocalDate()), ValidationFailure.BLACKOUT);
    }

    private static Optional<ValidationResult> fail(boolean failed, ValidationFailure failure) {
        return failed ? Optional.of(ValidationResult.invalid(failure)) : Optional.empty();
    }
}
