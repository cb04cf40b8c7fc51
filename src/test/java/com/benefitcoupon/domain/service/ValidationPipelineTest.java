package com.benefitcoupon.domain.service;

import com.benefitcoupon.config.CouponProperties;
import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.Merchant;
import com.benefitcoupon.domain.exception.ValidationFailure;
import com.benefitcoupon.domain.vo.BlackoutDate;
import com.benefitcoupon.domain.vo.GeoPoint;
import com.benefitcoupon.domain.vo.IssueMetadata;
import com.benefitcoupon.domain.vo.QuotaRule;
import com.benefitcoupon.domain.vo.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ValidationPipeline 테스트")
class ValidationPipelineTest {

    private static final Long MERCHANT_ID = 1L;
    private static final Long BENEFIT_ID = 10L;
    // 2025-03-03(월) 12:00 KST
    private static final Instant ISSUED_AT = Instant.parse("2025-03-03T03:00:00Z");
    private static final GeoPoint MERCHANT_LOCATION = GeoPoint.of(33.50, 126.52);

    private final ValidationPipeline pipeline =
            new ValidationPipeline(new CouponProperties(ZoneId.of("Asia/Seoul"), 3, 5));

    private Benefit benefit;
    private Merchant merchant;
    private Coupon coupon;

    @BeforeEach
    void setUp() {
        benefit = new Benefit(MERCHANT_ID, "아메리카노 1+1",
                Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-12-31T00:00:00Z"),
                150, QuotaRule.defaults(), false);
        benefit.setId(BENEFIT_ID);

        merchant = new Merchant("제주 카페", MERCHANT_LOCATION);
        merchant.setId(MERCHANT_ID);

        coupon = createCoupon(ISSUED_AT);
    }

    private Coupon createCoupon(Instant issuedAt) {
        Coupon created = new Coupon(BENEFIT_ID, 100L, "token-1", "4821", "reservation-1",
                issuedAt, IssueMetadata.empty());
        created.setId(1000L);
        return created;
    }

    private ValidationResult run(GeoPoint location, Instant now) {
        return pipeline.run(new ValidationInput(coupon, benefit, merchant, MERCHANT_ID, location, now));
    }

    @Test
    @DisplayName("모든 조건을 만족하면 유효하다")
    void valid() {
        // when
        ValidationResult result = run(MERCHANT_LOCATION, ISSUED_AT.plusSeconds(60));

        // then
        assertThat(result.valid()).isTrue();
        assertThat(result.coupon()).isSameAs(coupon);
        assertThat(result.reason()).isNull();
    }

    @Nested
    @DisplayName("쿠폰 상태 검사")
    class CouponChecks {

        @Test
        @DisplayName("쿠폰이 없으면 NotFound")
        void notFound() {
            ValidationResult result = pipeline.run(new ValidationInput(
                    null, null, merchant, MERCHANT_ID, MERCHANT_LOCATION, ISSUED_AT));

            assertThat(result.valid()).isFalse();
            assertThat(result.failure()).isEqualTo(ValidationFailure.NOT_FOUND);
            assertThat(result.reason()).isEqualTo("NotFound");
            assertThat(result.code()).isEqualTo("NOT_FOUND");
        }

        @Test
        @DisplayName("이미 사용된 쿠폰은 만료 여부보다 먼저 AlreadyRedeemed")
        void alreadyRedeemed_beforeExpired() {
            // given
            ReflectionTestUtils.setField(coupon, "redeemedAt", ISSUED_AT.plusSeconds(30));

            // when
            ValidationResult result = run(MERCHANT_LOCATION, ISSUED_AT.plus(Duration.ofHours(1)));

            // then
            assertThat(result.failure()).isEqualTo(ValidationFailure.ALREADY_REDEEMED);
        }

        @Test
        @DisplayName("발급 11분 후 사용하면 Expired")
        void expiredAfterElevenMinutes() {
            ValidationResult result = run(MERCHANT_LOCATION, ISSUED_AT.plus(Duration.ofMinutes(11)));

            assertThat(result.failure()).isEqualTo(ValidationFailure.EXPIRED);
        }

        @Test
        @DisplayName("만료 시각 정각에는 아직 유효하다")
        void validAtExactExpireAt() {
            ValidationResult result = run(MERCHANT_LOCATION, coupon.getExpireAt());

            assertThat(result.valid()).isTrue();
        }

        @Test
        @DisplayName("혜택을 찾을 수 없으면 BenefitMissing")
        void benefitMissing() {
            ValidationResult result = pipeline.run(new ValidationInput(
                    coupon, null, merchant, MERCHANT_ID, MERCHANT_LOCATION, ISSUED_AT));

            assertThat(result.failure()).isEqualTo(ValidationFailure.BENEFIT_MISSING);
        }

        @Test
        @DisplayName("다른 가맹점에서 사용하면 MerchantMismatch")
        void merchantMismatch() {
            ValidationResult result = pipeline.run(new ValidationInput(
                    coupon, benefit, merchant, 2L, MERCHANT_LOCATION, ISSUED_AT));

            assertThat(result.failure()).isEqualTo(ValidationFailure.MERCHANT_MISMATCH);
        }
    }

    @Nested
    @DisplayName("지오펜스 검사")
    class GeofenceChecks {

        @Test
        @DisplayName("매장에서 500m 떨어져 있으면 OutOfGeofence와 거리 표기를 반환한다")
        void outOfGeofence() {
            // when
            ValidationResult result = run(GeoPoint.of(33.5045, 126.52), ISSUED_AT);

            // then
            assertThat(result.failure()).isEqualTo(ValidationFailure.OUT_OF_GEOFENCE);
            assertThat(result.reason()).isEqualTo("OutOfGeofence");
            assertThat(result.distanceFormatted()).isEqualTo("500m");
            assertThat(result.message()).contains("150m", "500m");
        }

        @Test
        @DisplayName("위치를 보내지 않으면 지오펜스 검사를 건너뛴다")
        void noLocation_skipsGeofence() {
            ValidationResult result = run(null, ISSUED_AT);

            assertThat(result.valid()).isTrue();
        }

        @Test
        @DisplayName("반경이 0인 혜택은 위치와 관계없이 통과한다")
        void zeroRadius_skipsGeofence() {
            // given
            Benefit noGeofence = new Benefit(MERCHANT_ID, "전국 혜택",
                    Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-12-31T00:00:00Z"),
                    0, null, false);
            noGeofence.setId(BENEFIT_ID);

            // when
            ValidationResult result = pipeline.run(new ValidationInput(
                    coupon, noGeofence, merchant, MERCHANT_ID, GeoPoint.of(37.5665, 126.9780), ISSUED_AT));

            // then
            assertThat(result.valid()).isTrue();
        }

        @Test
        @DisplayName("매장 위치를 모르면 MerchantLocationUnknown")
        void merchantLocationUnknown() {
            // given
            Merchant withoutLocation = new Merchant("위치 미등록 매장", null);
            withoutLocation.setId(MERCHANT_ID);

            // when
            ValidationResult result = pipeline.run(new ValidationInput(
                    coupon, benefit, withoutLocation, MERCHANT_ID, MERCHANT_LOCATION, ISSUED_AT));

            // then
            assertThat(result.failure()).isEqualTo(ValidationFailure.MERCHANT_LOCATION_UNKNOWN);
        }

        @Test
        @DisplayName("가맹점 불일치가 지오펜스보다 먼저 보고된다")
        void firstFailureOnly() {
            ValidationResult result = pipeline.run(new ValidationInput(
                    coupon, benefit, merchant, 2L, GeoPoint.of(33.5045, 126.52), ISSUED_AT));

            assertThat(result.failure()).isEqualTo(ValidationFailure.MERCHANT_MISMATCH);
        }
    }

    @Nested
    @DisplayName("시간대 / 사용 불가일 검사")
    class CalendarChecks {

        @Test
        @DisplayName("매장 현지 시각 기준으로 시간대를 판정한다")
        void timeWindow_usesStoreZone() {
            // given: UTC 03:00은 KST 12:00
            benefit.addTimeWindow(TimeWindow.of(DayOfWeek.MONDAY, LocalTime.of(2, 0), LocalTime.of(4, 0)));

            // when
            ValidationResult result = run(MERCHANT_LOCATION, ISSUED_AT);

            // then
            assertThat(result.failure()).isEqualTo(ValidationFailure.OUTSIDE_TIME_WINDOW);
        }

        @Test
        @DisplayName("현지 시각이 시간대 안이면 통과한다")
        void timeWindow_within() {
            benefit.addTimeWindow(TimeWindow.of(DayOfWeek.MONDAY, LocalTime.of(11, 0), LocalTime.of(14, 0)));

            assertThat(run(MERCHANT_LOCATION, ISSUED_AT).valid()).isTrue();
        }

        @Test
        @DisplayName("매장 현지 날짜가 사용 불가일이면 Blackout")
        void blackout_usesStoreDate() {
            // given: UTC 3/2 16:00은 KST 3/3 01:00
            Instant issuedAt = Instant.parse("2025-03-02T16:00:00Z");
            coupon = createCoupon(issuedAt);
            benefit.addBlackoutDate(BlackoutDate.of(LocalDate.of(2025, 3, 3)));

            // when
            ValidationResult result = run(MERCHANT_LOCATION, issuedAt);

            // then
            assertThat(result.failure()).isEqualTo(ValidationFailure.BLACKOUT);
        }
    }
}
