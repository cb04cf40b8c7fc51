package com.benefitcoupon.exception;

import com.benefitcoupon.dto.ResponseCode;
import lombok.Getter;

/**
 * 요청 처리 중 도메인 밖에서 발생한 비즈니스 예외
 *
 * 사용 예시:
 * - throw new BusinessException(ResponseCode.BAD_REQUEST, "status 값이 올바르지 않습니다", "InvalidStatus");
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ResponseCode responseCode;
    private final String customMessage;
    private final String reason;

    public BusinessException(ResponseCode responseCode) {
        this(responseCode, null, null);
    }

    public BusinessException(ResponseCode responseCode, String customMessage, String reason) {
        super(customMessage != null ? customMessage : responseCode.getMessage());
        this.responseCode = responseCode;
        this.customMessage = customMessage;
        this.reason = reason;
    }

    public String getErrorMessage() {
        return customMessage != null ? customMessage : responseCode.getMessage();
    }
}
