package com.benefitcoupon.domain.service;

import com.benefitcoupon.domain.vo.BoundingBox;
import com.benefitcoupon.domain.vo.GeoPoint;
import com.benefitcoupon.domain.vo.GeofenceResult;

import java.util.Locale;

/**
 * 거리 계산 및 지오펜스 판정
 *
 * 모든 메서드는 부수 효과가 없는 순수 함수입니다.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000d;
    private static final double METERS_PER_LATITUDE_DEGREE = 111_000d;

    private GeoMath() {
    }

    /**
     * Haversine 공식으로 두 지점 사이의 대원 거리를 계산합니다.
     *
     * @return 거리 (미터)
     */
    public static double distanceMeters(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * 사용자 위치가 대상 지점 반경 이내인지 판정합니다. 경계값은 반경 이내로 봅니다.
     */
    public static GeofenceResult withinRadius(double userLat, double userLng,
                                              double targetLat, double targetLng,
                                              double radiusMeters) {
        double distance = distanceMeters(userLat, userLng, targetLat, targetLng);
        return new GeofenceResult(distance <= radiusMeters, distance, formatDistance(distance));
    }

    public static GeofenceResult withinRadius(GeoPoint user, GeoPoint target, double radiusMeters) {
        return withinRadius(user.getLatitude(), user.getLongitude(),
                target.getLatitude(), target.getLongitude(), radiusMeters);
    }

    /**
     * 오류 메시지용 거리 표기
     * - 1km 미만: "{n}m"
     * - 10km 미만: "{x.x}km"
     * - 그 이상: "{n}km"
     */
    public static String formatDistance(double meters) {
        if (meters < 1_000) {
            return Math.round(meters) + "m";
        }
        double km = meters / 1_000;
        if (km < 10) {
            return String.format(Locale.ROOT, "%.1fkm", km);
        }
        return Math.round(km) + "km";
    }

    /**
     * 반경을 감싸는 대략적인 사각 영역 (위도 1도 ≈ 111km)
     */
    public static BoundingBox boundingBox(double lat, double lng, double radiusMeters) {
        double latDiff = radiusMeters / METERS_PER_LATITUDE_DEGREE;
        double lngDiff = radiusMeters / (METERS_PER_LATITUDE_DEGREE * Math.cos(Math.toRadians(lat)));

        return new BoundingBox(lat - latDiff, lat + latDiff, lng - lngDiff, lng + lngDiff);
    }
}
