package com.benefitcoupon.domain.vo;

/**
 * 반경 검색용 사각 영역
 */
public record BoundingBox(double minLat, double maxLat, double minLng, double maxLng) {

    public boolean contains(double lat, double lng) {
        return lat >= minLat && lat <= maxLat && lng >= minLng && lng <= maxLng;
    }
}
