package com.benefitcoupon.infrastructure.redis;

import com.benefitcoupon.config.IntegrationTestSupport;
import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.exception.QuotaExceededException;
import com.benefitcoupon.domain.service.QuotaScope;
import com.benefitcoupon.domain.service.Reservation;
import com.benefitcoupon.domain.vo.QuotaRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lua Script 기반 발급 한도 테스트
 *
 * 스크립트는 Redis 안에서 실행되므로 실제 Redis로 확인합니다.
 */
@DisplayName("RedisQuotaGuard 테스트")
class RedisQuotaGuardTest extends IntegrationTestSupport {

    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    @Autowired
    private RedisQuotaGuard quotaGuard;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private Instant now;

    @BeforeEach
    void setUp() {
        redisTemplate.getConnectionFactory().getConnection().serverCommands().flushAll();
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private Benefit benefit(long id, QuotaRule rule) {
        Benefit benefit = new Benefit(1L, "아메리카노 1+1", now.minus(1, ChronoUnit.DAYS),
                now.plus(1, ChronoUnit.DAYS), 150, rule, false);
        benefit.setId(id);
        return benefit;
    }

    private Instant expireAt() {
        return now.plus(10, ChronoUnit.MINUTES);
    }

    @Nested
    @DisplayName("한도 예약")
    class Reserve {

        @Test
        @DisplayName("한도 안이면 모든 카운터가 증가한다")
        void reserve_withinLimits() {
            // given
            Benefit benefit = benefit(1L, QuotaRule.of(10, 5, 1));

            // when
            Reservation reservation = quotaGuard.reserve(benefit, 100L, now, expireAt());

            // then
            assertThat(reservation.reservationId()).isNotBlank();
            assertThat(reservation.issueDate()).isEqualTo(LocalDate.ofInstant(now, SEOUL));
            assertThat(quotaGuard.getTotalIssued(1L)).isEqualTo(1);
            assertThat(quotaGuard.getDailyIssued(1L, reservation.issueDate())).isEqualTo(1);
            assertThat(quotaGuard.getUserHolds(1L, 100L)).isEqualTo(1);
        }

        @Test
        @DisplayName("사용자 한도를 넘으면 user 범위로 거부하고 카운터는 그대로다")
        void reserve_userLimitExceeded() {
            // given
            Benefit benefit = benefit(2L, QuotaRule.defaults());
            quotaGuard.reserve(benefit, 100L, now, expireAt());

            // when & then
            assertThatThrownBy(() -> quotaGuard.reserve(benefit, 100L, now, expireAt()))
                    .isInstanceOf(QuotaExceededException.class)
                    .extracting(e -> ((QuotaExceededException) e).getScope())
                    .isEqualTo(QuotaScope.USER);
            assertThat(quotaGuard.getTotalIssued(2L)).isEqualTo(1);
        }

        @Test
        @DisplayName("총 한도를 먼저 확인한다")
        void reserve_totalLimitCheckedFirst() {
            // given
            Benefit benefit = benefit(3L, QuotaRule.of(1, 1, 1));
            quotaGuard.reserve(benefit, 100L, now, expireAt());

            // when & then
            assertThatThrownBy(() -> quotaGuard.reserve(benefit, 100L, now, expireAt()))
                    .isInstanceOf(QuotaExceededException.class)
                    .extracting(e -> ((QuotaExceededException) e).getScope())
                    .isEqualTo(QuotaScope.TOTAL);
        }

        @Test
        @DisplayName("일일 한도는 다른 사용자에게도 적용된다")
        void reserve_dailyLimitExceeded() {
            // given
            Benefit benefit = benefit(4L, QuotaRule.of(null, 1, 1));
            quotaGuard.reserve(benefit, 100L, now, expireAt());

            // when & then
            assertThatThrownBy(() -> quotaGuard.reserve(benefit, 200L, now, expireAt()))
                    .isInstanceOf(QuotaExceededException.class)
                    .extracting(e -> ((QuotaExceededException) e).getScope())
                    .isEqualTo(QuotaScope.DAILY);
        }

        @Test
        @DisplayName("한도가 0이면 첫 요청부터 거부한다")
        void reserve_zeroLimit() {
            Benefit benefit = benefit(5L, QuotaRule.of(0, null, 1));

            assertThatThrownBy(() -> quotaGuard.reserve(benefit, 100L, now, expireAt()))
                    .isInstanceOf(QuotaExceededException.class);
            assertThat(quotaGuard.getTotalIssued(5L)).isZero();
        }

        @Test
        @DisplayName("한도 컬럼이 모두 비어 있는 혜택은 총/일일 무제한, 사용자당 1장이다")
        void reserve_benefitWithoutStoredLimits() {
            // given
            Benefit benefit = benefit(7L, QuotaRule.of(1, 1, 1));
            ReflectionTestUtils.setField(benefit, "quotaRule", null);

            // when
            for (long userId = 1; userId <= 5; userId++) {
                quotaGuard.reserve(benefit, userId, now, expireAt());
            }

            // then
            assertThat(quotaGuard.getTotalIssued(7L)).isEqualTo(5);
            assertThatThrownBy(() -> quotaGuard.reserve(benefit, 1L, now, expireAt()))
                    .isInstanceOf(QuotaExceededException.class)
                    .extracting(e -> ((QuotaExceededException) e).getScope())
                    .isEqualTo(QuotaScope.USER);
        }

        @Test
        @DisplayName("총/일일 발급 수 키는 만료되지 않는다")
        void reserve_countersHaveNoTtl() {
            // given
            Benefit benefit = benefit(8L, QuotaRule.of(10, 10, 1));

            // when
            Reservation reservation = quotaGuard.reserve(benefit, 100L, now, expireAt());

            // then
            assertThat(redisTemplate.getExpire("quota:benefit:{8}:total")).isEqualTo(-1L);
            assertThat(redisTemplate.getExpire("quota:benefit:{8}:daily:" + reservation.issueDate())).isEqualTo(-1L);
            assertThat(redisTemplate.getExpire("quota:benefit:{8}:user:100")).isPositive();
        }

        @Test
        @DisplayName("만료된 보유분은 사용자 한도에서 제외된다")
        void reserve_expiredHoldIsPurged() {
            // given
            Benefit benefit = benefit(6L, QuotaRule.defaults());
            quotaGuard.reserve(benefit, 100L, now.minus(20, ChronoUnit.MINUTES), now.minus(10, ChronoUnit.MINUTES));

            // when
            Reservation reservation = quotaGuard.reserve(benefit, 100L, now, expireAt());

            // then
            assertThat(reservation).isNotNull();
            assertThat(quotaGuard.getUserHolds(6L, 100L)).isEqualTo(1);
            assertThat(quotaGuard.getTotalIssued(6L)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("예약 반환")
    class Release {

        @Test
        @DisplayName("반환하면 모든 카운터가 되돌아간다")
        void release_restoresCounters() {
            // given
            Benefit benefit = benefit(10L, QuotaRule.of(10, 10, 1));
            Reservation reservation = quotaGuard.reserve(benefit, 100L, now, expireAt());

            // when
            quotaGuard.release(reservation);

            // then
            assertThat(quotaGuard.getTotalIssued(10L)).isZero();
            assertThat(quotaGuard.getDailyIssued(10L, reservation.issueDate())).isZero();
            assertThat(quotaGuard.getUserHolds(10L, 100L)).isZero();
        }

        @Test
        @DisplayName("같은 예약을 두 번 반환해도 한 번만 반영된다")
        void release_isIdempotent() {
            // given
            Benefit benefit = benefit(11L, QuotaRule.of(10, 10, 2));
            quotaGuard.reserve(benefit, 100L, now, expireAt());
            Reservation reservation = quotaGuard.reserve(benefit, 100L, now, expireAt());

            // when
            quotaGuard.release(reservation);
            quotaGuard.release(reservation);

            // then
            assertThat(quotaGuard.getTotalIssued(11L)).isEqualTo(1);
            assertThat(quotaGuard.getUserHolds(11L, 100L)).isEqualTo(1);
        }

        @Test
        @DisplayName("사용자 보유분만 해제하면 총 발급 수는 유지되고 다시 발급받을 수 있다")
        void releaseUserHold_keepsTotal() {
            // given
            Benefit benefit = benefit(12L, QuotaRule.defaults());
            Reservation reservation = quotaGuard.reserve(benefit, 100L, now, expireAt());

            // when
            quotaGuard.releaseUserHold(reservation);

            // then
            assertThat(quotaGuard.getTotalIssued(12L)).isEqualTo(1);
            assertThat(quotaGuard.getUserHolds(12L, 100L)).isZero();
            assertThat(quotaGuard.reserve(benefit, 100L, now, expireAt())).isNotNull();
        }
    }

    @Nested
    @DisplayName("동시성")
    class Concurrency {

        @Test
        @DisplayName("100명 동시 요청, 총 10장 한정 - 정확히 10명만 성공")
        void reserve_concurrent100Users_10Total() throws InterruptedException {
            // given
            int totalUsers = 100;
            int totalLimit = 10;
            Benefit benefit = benefit(20L, QuotaRule.of(totalLimit, null, 1));

            ExecutorService executor = Executors.newFixedThreadPool(20);
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch endLatch = new CountDownLatch(totalUsers);
            AtomicInteger successCount = new AtomicInteger(0);
            AtomicInteger rejectedCount = new AtomicInteger(0);

            // when
            for (int i = 1; i <= totalUsers; i++) {
                final long userId = i;
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        quotaGuard.reserve(benefit, userId, now, expireAt());
                        successCount.incrementAndGet();
                    } catch (QuotaExceededException e) {
                        rejectedCount.incrementAndGet();
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
            assertThat(successCount.get()).isEqualTo(totalLimit);
            assertThat(rejectedCount.get()).isEqualTo(totalUsers - totalLimit);
            assertThat(quotaGuard.getTotalIssued(20L)).isEqualTo(totalLimit);
        }

        @Test
        @DisplayName("한 사용자의 동시 요청 중 하나만 성공")
        void reserve_sameUserConcurrent() throws InterruptedException {
            // given
            int attempts = 20;
            Benefit benefit = benefit(21L, QuotaRule.defaults());

            ExecutorService executor = Executors.newFixedThreadPool(attempts);
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch endLatch = new CountDownLatch(attempts);
            AtomicInteger successCount = new AtomicInteger(0);

            // when
            for (int i = 0; i < attempts; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        quotaGuard.reserve(benefit, 100L, now, expireAt());
                        successCount.incrementAndGet();
                    } catch (QuotaExceededException e) {
                        // 한도 초과는 예상된 결과
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
            assertThat(quotaGuard.getUserHolds(21L, 100L)).isEqualTo(1);
        }
    }
}
