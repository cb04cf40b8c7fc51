package com.benefitcoupon.infrastructure.persistence.repository;

import com.benefitcoupon.domain.entity.Coupon;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JpaCouponRepository extends JpaRepository<Coupon, Long> {

    Optional<Coupon> findByToken(String token);

    List<Coupon> findByUserIdOrderByIssuedAtDesc(Long userId);

    @Query("select c from Coupon c where c.pin = :pin and c.benefitId in :benefitIds "
            + "and c.redeemedAt is null and c.expireAt >= :now")
    List<Coupon> findPendingByPin(@Param("pin") String pin,
                                  @Param("benefitIds") Collection<Long> benefitIds,
                                  @Param("now") Instant now);

    @Query("select c from Coupon c where c.userId = :userId "
            + "and c.redeemedAt is null and c.expireAt >= :now order by c.issuedAt desc")
    List<Coupon> findPendingByUserId(@Param("userId") Long userId, @Param("now") Instant now);

    @Query("select c from Coupon c where c.userId = :userId "
            + "and c.redeemedAt is not null order by c.issuedAt desc")
    List<Coupon> findRedeemedByUserId(@Param("userId") Long userId);

    @Query("select c from Coupon c where c.userId = :userId "
            + "and c.redeemedAt is null and c.expireAt < :now order by c.issuedAt desc")
    List<Coupon> findExpiredByUserId(@Param("userId") Long userId, @Param("now") Instant now);

    @Query("select count(c) from Coupon c where c.benefitId = :benefitId and c.userId = :userId "
            + "and c.redeemedAt is null and c.expireAt >= :now")
    long countPendingByBenefitIdAndUserId(@Param("benefitId") Long benefitId,
                                          @Param("userId") Long userId,
                                          @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Coupon c set c.redeemedAt = :redeemedAt where c.id = :id and c.redeemedAt is null")
    int markRedeemedIfPending(@Param("id") Long id, @Param("redeemedAt") Instant redeemedAt);

    @Query("select count(c) from Coupon c where (:benefitId is null or c.benefitId = :benefitId)")
    long countIssued(@Param("benefitId") Long benefitId);

    @Query("select count(c) from Coupon c where (:benefitId is null or c.benefitId = :benefitId) "
            + "and c.redeemedAt is not null")
    long countRedeemed(@Param("benefitId") Long benefitId);

    @Query("select count(c) from Coupon c where (:benefitId is null or c.benefitId = :benefitId) "
            + "and c.redeemedAt is null and c.expireAt >= :now")
    long countPending(@Param("benefitId") Long benefitId, @Param("now") Instant now);

    @Query("select count(c) from Coupon c where (:benefitId is null or c.benefitId = :benefitId) "
            + "and c.redeemedAt is null and c.expireAt < :now")
    long countExpired(@Param("benefitId") Long benefitId, @Param("now") Instant now);
}
