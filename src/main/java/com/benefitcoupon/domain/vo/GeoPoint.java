package com.benefitcoupon.domain.vo;

import com.benefitcoupon.domain.exception.CoordinateParseException;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 위도/경도 좌표를 나타내는 Value Object
 * 범위를 벗어난 좌표는 보정하지 않고 거부합니다.
 */
public class GeoPoint {

    private static final Pattern LAT_LNG_PATTERN = Pattern.compile(
            "^(-?\\d+(?:\\.\\d+)?)\\s*,\\s*(-?\\d+(?:\\.\\d+)?)$"
    );
    private static final Pattern WKT_POINT_PATTERN = Pattern.compile(
            "^POINT\\s*\\(\\s*(-?\\d+(?:\\.\\d+)?)\\s+(-?\\d+(?:\\.\\d+)?)\\s*\\)$",
            Pattern.CASE_INSENSITIVE
    );

    private final double latitude;
    private final double longitude;

    private GeoPoint(double latitude, double longitude) {
        if (Double.isNaN(latitude) || Math.abs(latitude) > 90) {
            throw new CoordinateParseException(latitude + "," + longitude, "위도는 -90 ~ 90 범위여야 합니다");
        }
        if (Double.isNaN(longitude) || Math.abs(longitude) > 180) {
            throw new CoordinateParseException(latitude + "," + longitude, "경도는 -180 ~ 180 범위여야 합니다");
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * 정적 팩토리 메서드
     */
    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * "lat,lng" 또는 "POINT(lng lat)" 형식의 문자열을 파싱합니다.
     *
     * @throws CoordinateParseException 형식 오류 또는 범위 초과 시
     */
    public static GeoPoint parse(String text) {
        if (text == null || text.isBlank()) {
            throw new CoordinateParseException(text, "좌표 문자열이 비어 있습니다");
        }
        String trimmed = text.trim();

        Matcher latLng = LAT_LNG_PATTERN.matcher(trimmed);
        if (latLng.matches()) {
            return new GeoPoint(Double.parseDouble(latLng.group(1)), Double.parseDouble(latLng.group(2)));
        }

        // WKT는 경도가 먼저 온다
        Matcher wkt = WKT_POINT_PATTERN.matcher(trimmed);
        if (wkt.matches()) {
            return new GeoPoint(Double.parseDouble(wkt.group(2)), Double.parseDouble(wkt.group(1)));
        }

        throw new CoordinateParseException(text, "지원하지 않는 좌표 형식입니다: " + text);
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    /**
     * WKT 표현을 반환합니다 (예: "POINT(126.52 33.5)")
     */
    public String toWkt() {
        return "POINT(" + plain(longitude) + " " + plain(latitude) + ")";
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeoPoint geoPoint = (GeoPoint) o;
        return Double.compare(latitude, geoPoint.latitude) == 0
                && Double.compare(longitude, geoPoint.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude);
    }

    @Override
    public String toString() {
        return latitude + "," + longitude;
    }
}
