package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.RedemptionRecord;

/**
 * 사용 처리 결과 (사용된 쿠폰과 사용 기록)
 */
public record Redemption(Coupon coupon, RedemptionRecord record) {
}
