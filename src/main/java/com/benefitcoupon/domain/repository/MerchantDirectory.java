package com.benefitcoupon.domain.repository;

import com.benefitcoupon.domain.entity.Merchant;

import java.util.Optional;

/**
 * 가맹점 디렉터리 (읽기 전용)
 */
public interface MerchantDirectory {

    Optional<Merchant> findById(Long merchantId);
}
