package com.benefitcoupon.infrastructure.lock;

import com.benefitcoupon.config.CouponProperties;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 분산 락 실행기
 *
 * 같은 쿠폰에 대한 사용 요청을 인스턴스 간에 직렬화합니다.
 * 정합성은 DB 조건부 UPDATE가 보장하며, 락은 경합 요청을 앞단에서 줄이는 역할입니다.
 *
 * 사용 예시:
 * - lockExecutor.executeWithLock("lock:coupon:redeem:" + token, () -> lifecycle.redeem(command));
 */
@Component
@RequiredArgsConstructor
public class DistributedLockExecutor {

    private final RedissonClient redissonClient;
    private final CouponProperties couponProperties;

    /**
     * 설정된 대기/유지 시간으로 락을 획득하고 작업을 실행합니다.
     *
     * @throws LockAcquisitionException 락 획득 실패 시
     */
    public <T> T executeWithLock(String lockKey, Supplier<T> task) {
        return executeWithLock(lockKey,
                couponProperties.getLockWaitSeconds(),
                couponProperties.getLockLeaseSeconds(),
                task);
    }

    /**
     * @param waitTimeSeconds 락 획득 대기 시간 (초)
     * @param leaseTimeSeconds 락 유지 시간 (초)
     * @throws LockAcquisitionException 락 획득 실패 시
     */
    public <T> T executeWithLock(String lockKey, long waitTimeSeconds, long leaseTimeSeconds, Supplier<T> task) {
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(waitTimeSeconds, leaseTimeSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new LockAcquisitionException("락 획득 실패: " + lockKey);
            }

            return task.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 획득 중 인터럽트 발생: " + lockKey, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
