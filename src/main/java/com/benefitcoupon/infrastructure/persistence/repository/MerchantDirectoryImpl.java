package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.config.CaffeineCacheConfig;
import com.benefitcoupon.domain.entity.Merchant;
import com.benefitcoupon.domain.repository.MerchantDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class MerchantDirectoryImpl implements MerchantDirectory {

    private final JpaMerchantRepository jpaMerchantRepository;

    @Override
    @Cacheable(cacheNames = CaffeineCacheConfig.MERCHANT_CACHE, key = "#merchantId", unless = "#result == null")
    public Optional<Merchant> findById(Long merchantId) {
        return jpaMerchantRepository.findById(merchantId);
    }
}
