package com.benefitcoupon.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * API 응답 코드 정의
 *
 * 코드 구조: {도메인}_{숫자}
 * - COMMON: 1xxx (공통)
 * - BENEFIT: 2xxx (혜택 자격)
 * - QUOTA: 3xxx (발급 한도)
 * - COUPON: 4xxx (쿠폰 발급/사용)
 */
@Getter
@RequiredArgsConstructor
public enum ResponseCode {

    // ===== 공통 (1xxx) =====
    SUCCESS(HttpStatus.OK, "COMMON_1000", "요청이 성공적으로 처리되었습니다."),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "COMMON_1400", "잘못된 요청입니다."),
    INVALID_LOCATION(HttpStatus.BAD_REQUEST, "COMMON_1401", "위치 형식이 올바르지 않습니다."),
    CONFLICT(HttpStatus.CONFLICT, "COMMON_1409", "동시 요청이 처리 중입니다. 잠시 후 다시 시도해주세요."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "COMMON_1500", "서버 내부 오류가 발생했습니다."),

    // ===== 혜택 (2xxx) =====
    BENEFIT_NOT_FOUND(HttpStatus.BAD_REQUEST, "BENEFIT_2001", "혜택을 찾을 수 없습니다."),
    BENEFIT_INACTIVE(HttpStatus.BAD_REQUEST, "BENEFIT_2002", "진행 중인 혜택이 아닙니다."),
    BENEFIT_OUT_OF_VALIDITY(HttpStatus.BAD_REQUEST, "BENEFIT_2003", "혜택 유효 기간이 아닙니다."),
    BENEFIT_STUDENT_ONLY(HttpStatus.BAD_REQUEST, "BENEFIT_2004", "학생 인증 사용자만 받을 수 있는 혜택입니다."),

    // ===== 발급 한도 (3xxx) =====
    QUOTA_EXCEEDED(HttpStatus.BAD_REQUEST, "QUOTA_3001", "쿠폰 발급 한도를 초과했습니다."),

    // ===== 쿠폰 (4xxx) =====
    COUPON_SUCCESS(HttpStatus.OK, "COUPON_4000", "쿠폰 조회에 성공했습니다."),
    COUPON_ISSUED(HttpStatus.CREATED, "COUPON_4001", "쿠폰이 발급되었습니다."),
    COUPON_REDEEMED(HttpStatus.OK, "COUPON_4002", "쿠폰이 사용되었습니다."),
    COUPON_VALIDATED(HttpStatus.OK, "COUPON_4003", "쿠폰 검증이 완료되었습니다."),
    COUPON_DUPLICATE_ACTIVE(HttpStatus.BAD_REQUEST, "COUPON_4004", "이미 사용 가능한 쿠폰을 보유하고 있습니다."),
    COUPON_NOT_FOUND(HttpStatus.BAD_REQUEST, "COUPON_4005", "쿠폰을 찾을 수 없습니다."),
    COUPON_ALREADY_USED(HttpStatus.BAD_REQUEST, "COUPON_4006", "이미 사용된 쿠폰입니다."),
    COUPON_EXPIRED(HttpStatus.BAD_REQUEST, "COUPON_4007", "만료된 쿠폰입니다."),
    COUPON_NOT_REDEEMABLE(HttpStatus.BAD_REQUEST, "COUPON_4008", "쿠폰을 사용할 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    public int getStatusCode() {
        return httpStatus.value();
    }
}
