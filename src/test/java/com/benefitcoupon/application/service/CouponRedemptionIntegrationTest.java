package com.benefitcoupon.application.service;

import com.benefitcoupon.application.dto.CouponResponse;
import com.benefitcoupon.application.dto.CouponStatsResponse;
import com.benefitcoupon.application.dto.CouponValidationResponse;
import com.benefitcoupon.application.dto.RedemptionResponse;
import com.benefitcoupon.config.IntegrationTestSupport;
import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.entity.Merchant;
import com.benefitcoupon.domain.exception.CouponRedemptionException;
import com.benefitcoupon.domain.exception.QuotaExceededException;
import com.benefitcoupon.domain.exception.ValidationFailure;
import com.benefitcoupon.domain.service.IssueCommand;
import com.benefitcoupon.domain.service.QuotaScope;
import com.benefitcoupon.domain.service.RedeemCommand;
import com.benefitcoupon.domain.vo.GeoPoint;
import com.benefitcoupon.domain.vo.IssueMetadata;
import com.benefitcoupon.domain.vo.QuotaRule;
import com.benefitcoupon.infrastructure.persistence.repository.JpaBenefitRepository;
import com.benefitcoupon.infrastructure.persistence.repository.JpaMerchantRepository;
import com.benefitcoupon.infrastructure.persistence.repository.JpaRedemptionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("쿠폰 발급/사용 통합 테스트")
class CouponRedemptionIntegrationTest extends IntegrationTestSupport {

    private static final GeoPoint STORE = GeoPoint.of(33.5, 126.52);
    private static final AtomicLong USER_SEQUENCE = new AtomicLong(1_000);

    @Autowired
    private CouponService couponService;

    @Autowired
    private JpaBenefitRepository benefitRepository;

    @Autowired
    private JpaMerchantRepository merchantRepository;

    @Autowired
    private JpaRedemptionRecordRepository redemptionRecordRepository;

    private Merchant merchant;
    private Benefit benefit;
    private Long userId;

    @BeforeEach
    void setUp() {
        // 컨텍스트와 DB를 테스트 클래스끼리 공유하므로 테스트마다 새 사용자
        userId = USER_SEQUENCE.incrementAndGet();
        Instant now = Instant.now();
        merchant = merchantRepository.save(new Merchant("제주 카페", STORE));
        benefit = benefitRepository.save(new Benefit(merchant.getId(), "아메리카노 1+1",
                now.minus(1, ChronoUnit.DAYS), now.plus(1, ChronoUnit.DAYS), 150, QuotaRule.defaults(), false));
    }

    private CouponResponse issue(Long userId) {
        return couponService.issueCoupon(new IssueCommand(userId, benefit.getId(), false,
                new IssueMetadata("device-1", "JUnit", "127.0.0.1")));
    }

    private RedeemCommand redeemByToken(String token, GeoPoint location) {
        return new RedeemCommand(token, null, merchant.getId(), location, 7L, "pos-1", "127.0.0.1");
    }

    @Test
    @DisplayName("발급한 쿠폰을 매장 안에서 사용한다")
    void issueAndRedeem() {
        // given
        CouponResponse issued = issue(userId);

        // when
        RedemptionResponse redemption = couponService.redeemCoupon(redeemByToken(issued.token(), STORE));

        // then
        assertThat(redemption.couponId()).isEqualTo(issued.id());
        assertThat(redemption.location()).isEqualTo("POINT(126.52 33.5)");
        assertThat(redemptionRecordRepository.findByCouponId(issued.id())).isPresent();
        assertThat(couponService.getUserCoupons(userId, "used"))
                .extracting(CouponResponse::status)
                .containsExactly("used");
    }

    @Test
    @DisplayName("사용 중인 쿠폰이 있으면 같은 혜택을 다시 발급받을 수 없다")
    void issue_twiceRejectedByUserLimit() {
        // given
        issue(userId);

        // when & then
        assertThatThrownBy(() -> issue(userId))
                .isInstanceOf(QuotaExceededException.class)
                .extracting(e -> ((QuotaExceededException) e).getScope())
                .isEqualTo(QuotaScope.USER);
    }

    @Test
    @DisplayName("사용한 뒤에는 같은 혜택을 다시 발급받을 수 있다")
    void issue_afterRedeem() {
        // given
        CouponResponse first = issue(userId);
        couponService.redeemCoupon(redeemByToken(first.token(), STORE));

        // when
        CouponResponse second = issue(userId);

        // then
        assertThat(second.id()).isNotEqualTo(first.id());
        assertThat(second.status()).isEqualTo("active");
    }

    @Test
    @DisplayName("매장 반경 밖에서는 사용할 수 없고 쿠폰은 그대로 남는다")
    void redeem_outOfGeofence() {
        // given
        CouponResponse issued = issue(userId);
        GeoPoint farAway = GeoPoint.of(33.5045, 126.52);

        // when & then
        assertThatThrownBy(() -> couponService.redeemCoupon(redeemByToken(issued.token(), farAway)))
                .isInstanceOf(CouponRedemptionException.class)
                .hasMessageContaining("500m");
        assertThat(couponService.getUserCoupons(userId, "active")).hasSize(1);
    }

    @Test
    @DisplayName("사용 전 검증은 상태를 바꾸지 않는다")
    void validate_doesNotChangeState() {
        // given
        CouponResponse issued = issue(userId);

        // when
        CouponValidationResponse first = couponService.validateCoupon(issued.token(), merchant.getId(), "33.5,126.52");
        CouponValidationResponse second = couponService.validateCoupon(issued.token(), merchant.getId(), "33.5,126.52");

        // then
        assertThat(first.valid()).isTrue();
        assertThat(second.valid()).isTrue();
        assertThat(couponService.getUserCoupons(userId, "active")).hasSize(1);
    }

    @Test
    @DisplayName("같은 쿠폰을 동시에 10번 사용하면 정확히 한 번만 성공한다")
    void redeem_concurrentSameCoupon() throws InterruptedException {
        // given
        CouponResponse issued = issue(userId);
        int attempts = 10;

        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(attempts);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger alreadyRedeemedCount = new AtomicInteger(0);

        // when
        for (int i = 0; i < attempts; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    couponService.redeemCoupon(redeemByToken(issued.token(), STORE));
                    successCount.incrementAndGet();
                } catch (CouponRedemptionException e) {
                    if (e.getFailure() == ValidationFailure.ALREADY_REDEEMED) {
                        alreadyRedeemedCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        endLatch.await(30, TimeUnit.SECONDS);
        executor.shutdown();

        // then
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(alreadyRedeemedCount.get()).isEqualTo(attempts - 1);
        CouponStatsResponse stats = couponService.getCouponStats(benefit.getId());
        assertThat(stats.totalIssued()).isEqualTo(1);
        assertThat(stats.totalRedeemed()).isEqualTo(1);
    }

    @Test
    @DisplayName("총 5장 한정 혜택에 30명이 동시에 발급받으면 정확히 5장만 발급된다")
    void issue_concurrentUsersBeyondTotalLimit() throws InterruptedException {
        // given
        Instant now = Instant.now();
        Benefit limited = benefitRepository.save(new Benefit(merchant.getId(), "선착순 5명 디저트",
                now.minus(1, ChronoUnit.DAYS), now.plus(1, ChronoUnit.DAYS), 150, QuotaRule.of(5, null, 1), false));
        int totalLimit = 5;
        int users = 30;

        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(users);
        ConcurrentLinkedQueue<CouponResponse> issuedCoupons = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<QuotaScope> rejectedScopes = new ConcurrentLinkedQueue<>();

        // when
        for (int i = 0; i < users; i++) {
            final Long requester = USER_SEQUENCE.incrementAndGet();
            executor.submit(() -> {
                try {
                    startLatch.await();
                    issuedCoupons.add(couponService.issueCoupon(new IssueCommand(requester, limited.getId(), false, null)));
                } catch (QuotaExceededException e) {
                    rejectedScopes.add(e.getScope());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        endLatch.await(30, TimeUnit.SECONDS);
        executor.shutdown();

        // then
        assertThat(issuedCoupons).hasSize(totalLimit);
        assertThat(rejectedScopes).hasSize(users - totalLimit).containsOnly(QuotaScope.TOTAL);
        assertThat(couponService.getCouponStats(limited.getId()).totalIssued()).isEqualTo(totalLimit);
    }
}
