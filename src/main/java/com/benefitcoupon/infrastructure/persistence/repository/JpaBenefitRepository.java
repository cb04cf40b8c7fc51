package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.domain.entity.Benefit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface JpaBenefitRepository extends JpaRepository<Benefit, Long> {

    @Query("select b.id from Benefit b where b.merchantId = :merchantId")
    List<Long> findIdsByMerchantId(@Param("merchantId") Long merchantId);
}
