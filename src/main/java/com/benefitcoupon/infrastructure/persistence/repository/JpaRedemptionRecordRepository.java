package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.domain.entity.RedemptionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JpaRedemptionRecordRepository extends JpaRepository<RedemptionRecord, Long> {

    Optional<RedemptionRecord> findByCouponId(Long couponId);
}
