package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.config.CaffeineCacheConfig;
import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.repository.BenefitCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 혜택 카탈로그 JPA 어댑터
 *
 * 혜택 규칙은 자주 바뀌지 않으므로 로컬 캐시에 짧게 보관합니다.
 * 시간대/사용 불가일 컬렉션은 EAGER 로딩이라 캐시된 엔티티에서도 그대로 읽을 수 있습니다.
 */
@Repository
@RequiredArgsConstructor
public class BenefitCatalogImpl implements BenefitCatalog {

    private final JpaBenefitRepository jpaBenefitRepository;

    @Override
    @Cacheable(cacheNames = CaffeineCacheConfig.BENEFIT_CACHE, key = "#benefitId", unless = "#result == null")
    public Optional<Benefit> findById(Long benefitId) {
        return jpaBenefitRepository.findById(benefitId);
    }

    @Override
    public List<Long> findIdsByMerchantId(Long merchantId) {
        return jpaBenefitRepository.findIdsByMerchantId(merchantId);
    }
}
