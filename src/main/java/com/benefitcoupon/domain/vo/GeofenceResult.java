package com.benefitcoupon.domain.vo;

/**
 * 지오펜스 판정 결과
 *
 * @param within 반경 이내 여부
 * @param distanceMeters 두 지점 사이 거리 (미터)
 * @param distanceFormatted 사람이 읽기 위한 거리 표기 (예: "500m", "1.3km")
 */
public record GeofenceResult(boolean within, double distanceMeters, String distanceFormatted) {
}
