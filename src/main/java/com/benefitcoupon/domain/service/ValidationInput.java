package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.entity.Benefit;
import com.benefitcoupon.domain.entity.Coupon;
import com.benefitcoupon.domain.entity.Merchant;
import com.benefitcoupon.domain.vo.GeoPoint;

import java.time.Instant;

/**
 * 검증 파이프라인 입력
 *
 * 조회 결과가 없으면 null로 전달합니다.
 *
 * @param coupon 토큰/PIN으로 찾은 쿠폰
 * @param benefit 쿠폰의 혜택
 * @param merchant 요청 가맹점
 * @param requestedMerchantId 사용을 요청한 가맹점 ID
 * @param location 사용 위치 (선택)
 * @param now 판정 기준 시각
 */
public record ValidationInput(Coupon coupon, Benefit benefit, Merchant merchant,
                              Long requestedMerchantId, GeoPoint location, Instant now) {
}
