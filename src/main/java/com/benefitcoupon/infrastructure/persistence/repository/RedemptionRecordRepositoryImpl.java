package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.domain.entity.RedemptionRecord;
import com.benefitcoupon.domain.repository.RedemptionRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class RedemptionRecordRepositoryImpl implements RedemptionRecordRepository {

    private final JpaRedemptionRecordRepository jpaRedemptionRecordRepository;

    @Override
    public RedemptionRecord save(RedemptionRecord record) {
        return jpaRedemptionRecordRepository.save(record);
    }

    @Override
    public Optional<RedemptionRecord> findByCouponId(Long couponId) {
        return jpaRedemptionRecordRepository.findByCouponId(couponId);
    }
}
