package com.benefitcoupon.domain.repository;

import com.benefitcoupon.domain.entity.Benefit;

import java.util.List;
import java.util.Optional;

/**
 * 혜택 카탈로그 (읽기 전용)
 */
public interface BenefitCatalog {

    Optional<Benefit> findById(Long benefitId);

    List<Long> findIdsByMerchantId(Long merchantId);
}
