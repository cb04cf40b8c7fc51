package com.benefitcoupon.application.dto;

import com.benefitcoupon.domain.vo.GeoPoint;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record LocationRequest(
    @NotNull(message = "위도는 필수입니다")
    @DecimalMin(value = "-90.0", message = "위도는 -90 ~ 90 범위여야 합니다")
    @DecimalMax(value = "90.0", message = "위도는 -90 ~ 90 범위여야 합니다")
    Double lat,

    @NotNull(message = "경도는 필수입니다")
    @DecimalMin(value = "-180.0", message = "경도는 -180 ~ 180 범위여야 합니다")
    @DecimalMax(value = "180.0", message = "경도는 -180 ~ 180 범위여야 합니다")
    Double lng
) {

    public GeoPoint toGeoPoint() {
        return GeoPoint.of(lat, lng);
    }
}
