package com.benefitcoupon.infrastructure.redis;

import com.benefitcoupon.config.CouponProperties;
import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.exception.QuotaExceededException;
import com.benefitcoupon.domain.service.QuotaGuard;
import com.benefitcoupon.domain.service.QuotaScope;
import com.benefitcoupon.domain.service.Reservation;
import com.benefitcoupon.domain.vo.QuotaRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

/**
 * Redis 기반 발급 한도 관리자
 *
 * Lua Script로 확인과 차감을 하나의 원자적 연산으로 실행합니다.
 * - total: 누적 발급 수 (반환 시에만 감소)
 * - daily: 매장 현지 날짜별 발급 수
 * - user: 사용자 보유분 Sorted Set (member=예약 ID, score=만료 시각 ms)
 *
 * 키의 {benefitId} 부분은 클러스터 해시 태그라서 한 혜택의 키는 같은 슬롯에 놓입니다.
 */
@Slf4j
@Component
public class RedisQuotaGuard implements QuotaGuard {

    private static final String KEY_PREFIX = "quota:benefit:{";
    private static final long UNLIMITED = -1;

    /**
     * 만료된 보유분 정리 → total → daily → user 순서로 확인 후 모두 통과할 때만 차감
     * - 만료 시각과 같은 시각의 보유분은 아직 유효
     */
    private static final String RESERVE_SCRIPT = """
            local totalKey = KEYS[1]
            local dailyKey = KEYS[2]
            local userKey = KEYS[3]
            local totalLimit = tonumber(ARGV[1])
            local dailyLimit = tonumber(ARGV[2])
            local userLimit = tonumber(ARGV[3])
            local now = ARGV[4]
            local expireAt = ARGV[5]
            local reservationId = ARGV[6]

            redis.call('ZREMRANGEBYSCORE', userKey, '-inf', '(' .. now)

            if totalLimit >= 0 and tonumber(redis.call('GET', totalKey) or '0') >= totalLimit then
                return 'TOTAL'
            end

            if dailyLimit >= 0 and tonumber(redis.call('GET', dailyKey) or '0') >= dailyLimit then
                return 'DAILY'
            end

            if userLimit >= 0 and redis.call('ZCARD', userKey) >= userLimit then
                return 'USER'
            end

            redis.call('INCR', totalKey)
            redis.call('INCR', dailyKey)
            redis.call('ZADD', userKey, expireAt, reservationId)
            redis.call('PEXPIREAT', userKey, expireAt)
            return 'OK'
            """;

    /**
     * 보유분이 남아 있을 때만 카운터를 되돌림 (중복 반환 무시)
     */
    private static final String RELEASE_SCRIPT = """
            local totalKey = KEYS[1]
            local dailyKey = KEYS[2]
            local userKey = KEYS[3]
            local reservationId = ARGV[1]

            if redis.call('ZREM', userKey, reservationId) == 0 then
                return 0
            end

            if tonumber(redis.call('GET', totalKey) or '0') > 0 then
                redis.call('DECR', totalKey)
            end
            if tonumber(redis.call('GET', dailyKey) or '0') > 0 then
                redis.call('DECR', dailyKey)
            end
            return 1
            """;

    private static final DefaultRedisScript<String> RESERVE_REDIS_SCRIPT;
    private static final DefaultRedisScript<Long> RELEASE_REDIS_SCRIPT;

    static {
        RESERVE_REDIS_SCRIPT = new DefaultRedisScript<>();
        RESERVE_REDIS_SCRIPT.setScriptText(RESERVE_SCRIPT);
        RESERVE_REDIS_SCRIPT.setResultType(String.class);

        RELEASE_REDIS_SCRIPT = new DefaultRedisScript<>();
        RELEASE_REDIS_SCRIPT.setScriptText(RELEASE_SCRIPT);
        RELEASE_REDIS_SCRIPT.setResultType(Long.class);
    }

    private final StringRedisTemplate redisTemplate;
    private final ZoneId zoneId;

    public RedisQuotaGuard(StringRedisTemplate redisTemplate, CouponProperties couponProperties) {
        this.redisTemplate = redisTemplate;
        this.zoneId = couponProperties.getZoneId();
    }

    @Override
    public Reservation reserve(Benefit benefit, Long userId, Instant issuedAt, Instant expireAt) {
        QuotaRule rule = benefit.getQuotaRule();
        LocalDate issueDate = LocalDate.ofInstant(issuedAt, zoneId);
        String reservationId = UUID.randomUUID().toString();

        String result = redisTemplate.execute(
                RESERVE_REDIS_SCRIPT,
                keys(benefit.getId(), issueDate, userId),
                limitArg(rule.getTotalLimit()),
                limitArg(rule.getDailyLimit()),
                limitArg(rule.getUserLimit()),
                String.valueOf(issuedAt.toEpochMilli()),
                String.valueOf(expireAt.toEpochMilli()),
                reservationId
        );

        if (!"OK".equals(result)) {
            QuotaScope scope = QuotaScope.valueOf(result);
            log.debug("발급 한도 초과: benefitId={}, userId={}, scope={}", benefit.getId(), userId, scope.getValue());
            throw new QuotaExceededException(scope);
        }

        log.debug("발급 한도 예약: benefitId={}, userId={}, reservationId={}", benefit.getId(), userId, reservationId);
        return new Reservation(reservationId, benefit.getId(), userId, issueDate, expireAt);
    }

    @Override
    public void release(Reservation reservation) {
        Long released = redisTemplate.execute(
                RELEASE_REDIS_SCRIPT,
                keys(reservation.benefitId(), reservation.issueDate(), reservation.userId()),
                reservation.reservationId()
        );
        log.info("발급 한도 예약 반환: benefitId={}, userId={}, reservationId={}, released={}",
                reservation.benefitId(), reservation.userId(), reservation.reservationId(),
                Long.valueOf(1L).equals(released));
    }

    @Override
    public void releaseUserHold(Reservation reservation) {
        redisTemplate.opsForZSet().remove(
                userKey(reservation.benefitId(), reservation.userId()), reservation.reservationId());
    }

    public long getTotalIssued(Long benefitId) {
        return readCounter(totalKey(benefitId));
    }

    public long getDailyIssued(Long benefitId, LocalDate date) {
        return readCounter(dailyKey(benefitId, date));
    }

    public long getUserHolds(Long benefitId, Long userId) {
        Long size = redisTemplate.opsForZSet().zCard(userKey(benefitId, userId));
        return size != null ? size : 0;
    }

    private long readCounter(String key) {
        String value = redisTemplate.opsForValue().get(key);
        return value != null ? Long.parseLong(value) : 0;
    }

    private List<String> keys(Long benefitId, LocalDate issueDate, Long userId) {
        return List.of(totalKey(benefitId), dailyKey(benefitId, issueDate), userKey(benefitId, userId));
    }

    private static String limitArg(Integer limit) {
        return String.valueOf(limit == null ? UNLIMITED : limit);
    }

    private static String totalKey(Long benefitId) {
        return KEY_PREFIX + benefitId + "}:total";
    }

    private static String dailyKey(Long benefitId, LocalDate date) {
        return KEY_PREFIX + benefitId + "}:daily:" + date;
    }

    private static String userKey(Long benefitId, Long userId) {
        return KEY_PREFIX + benefitId + "}:user:" + userId;
    }
}
