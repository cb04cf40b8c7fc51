package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.domain.entity.Merchant;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaMerchantRepository extends JpaRepository<Merchant, Long> {
}
