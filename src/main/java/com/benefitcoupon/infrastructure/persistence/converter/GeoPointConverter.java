package com.benefitcoupon.infrastructure.persistence.converter;

import com.benefitcoupon.domain.vo.GeoPoint;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * GeoPoint ↔ "POINT(lng lat)" 텍스트 컬럼 변환
 */
@Converter(autoApply = true)
public class GeoPointConverter implements AttributeConverter<GeoPoint, String> {

    @Override
    public String convertToDatabaseColumn(GeoPoint point) {
        return point == null ? null : point.toWkt();
    }

    @Override
    public GeoPoint convertToEntityAttribute(String text) {
        return text == null || text.isBlank() ? null : GeoPoint.parse(text);
    }
}
