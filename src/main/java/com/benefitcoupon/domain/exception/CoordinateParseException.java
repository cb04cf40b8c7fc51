package com.benefitcoupon.domain.exception;

/**
 * 좌표 문자열 파싱 실패 예외
 * 형식이 잘못되었거나 위도/경도 범위를 벗어난 경우 발생합니다.
 */
public class CoordinateParseException extends RuntimeException {

    private final String input;

    public CoordinateParseException(String input, String message) {
        super(message);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
