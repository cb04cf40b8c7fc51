package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.RedemptionRecord;
import com.benefitcoupon.domain.repository.RedemptionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 쿠폰 사용 기록 작성기
 *
 * 사용 처리와 같은 트랜잭션에서 호출되어야 합니다. 기록은 추가만 하며 쿠폰당 하나입니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedemptionRecorder {

    private final RedemptionRecordRepository redemptionRecordRepository;

    public RedemptionRecord append(Coupon coupon, RedeemCommand command, Instant redeemedAt) {
        RedemptionRecord record = new RedemptionRecord(
                coupon.getId(),
                command.merchantId(),
                command.redeemedBy(),
                command.location(),
                command.deviceId(),
                command.ipAddress(),
                redeemedAt
        );
        RedemptionRecord saved = redemptionRecordRepository.save(record);
        log.debug("쿠폰 사용 기록 저장: couponId={}, merchantId={}", coupon.getId(), command.merchantId());
        return saved;
    }
}
