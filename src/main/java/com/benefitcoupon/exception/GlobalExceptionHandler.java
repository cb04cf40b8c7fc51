package com.benefitcoupon.exception;

import com.benefitcoupon.domain.exception.CoordinateParseException;
import com.benefitcoupon.domain.exception.CouponIssueException;
import com.benefitcoupon.domain.exception.CouponRedemptionException;
import com.benefitcoupon.domain.exception.IssueFailure;
import com.benefitcoupon.domain.exception.QuotaExceededException;
import com.benefitcoupon.domain.exception.ValidationFailure;
import com.benefitcoupon.dto.ApiResponse;
import com.benefitcoupon.dto.ResponseCode;
import com.benefitcoupon.infrastructure.lock.LockAcquisitionException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 전역 예외 처리 핸들러
 *
 * 도메인 예외를 ResponseCode로 변환하고 실패 사유 문자열을 error 필드에 담습니다.
 * 예상하지 못한 예외는 내부 정보를 노출하지 않고 500으로 응답합니다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("BusinessException: code={}, reason={}, message={}",
                e.getResponseCode().getCode(), e.getReason(), e.getErrorMessage());
        return failure(e.getResponseCode(), e.getErrorMessage(), e.getReason());
    }

    @ExceptionHandler(CouponIssueException.class)
    public ResponseEntity<ApiResponse<Void>> handleCouponIssueException(CouponIssueException e) {
        IssueFailure failure = e.getFailure();
        log.info("쿠폰 발급 거절: reason={}", failure.getReason());
        return failure(toResponseCode(failure), e.getMessage(), failure.getReason());
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleQuotaExceededException(QuotaExceededException e) {
        log.info("쿠폰 발급 거절: reason={}", e.getReason());
        return failure(ResponseCode.QUOTA_EXCEEDED, e.getMessage(), e.getReason());
    }

    @ExceptionHandler(CouponRedemptionException.class)
    public ResponseEntity<ApiResponse<Void>> handleCouponRedemptionException(CouponRedemptionException e) {
        ValidationFailure failure = e.getFailure();
        return failure(toResponseCode(failure), e.getMessage(), failure.getReason());
    }

    @ExceptionHandler(CoordinateParseException.class)
    public ResponseEntity<ApiResponse<Void>> handleCoordinateParseException(CoordinateParseException e) {
        log.warn("CoordinateParseException: input={}, message={}", e.getInput(), e.getMessage());
        return failure(ResponseCode.INVALID_LOCATION, e.getMessage(), "InvalidLocation");
    }

    @ExceptionHandler(LockAcquisitionException.class)
    public ResponseEntity<ApiResponse<Void>> handleLockAcquisitionException(LockAcquisitionException e) {
        log.warn("LockAcquisitionException: {}", e.getMessage());
        ApiResponse<Void> response = ApiResponse.fail(ResponseCode.CONFLICT);
        return ResponseEntity
                .status(ResponseCode.CONFLICT.getHttpStatus())
                .body(response);
    }

    /**
     * Validation 예외 처리
     * @Valid, @Validated 어노테이션 검증 실패 시 발생합니다.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        String errorMessage = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        log.warn("ValidationException: {}", errorMessage);
        return badRequest(errorMessage);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolationException(ConstraintViolationException e) {
        log.warn("ConstraintViolationException: {}", e.getMessage());
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingRequestHeaderException(MissingRequestHeaderException e) {
        log.warn("MissingRequestHeaderException: header={}", e.getHeaderName());
        return badRequest("필수 헤더가 없습니다: " + e.getHeaderName());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameterException(MissingServletRequestParameterException e) {
        log.warn("MissingServletRequestParameterException: parameter={}", e.getParameterName());
        return badRequest("필수 파라미터가 없습니다: " + e.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        log.warn("MethodArgumentTypeMismatchException: name={}, value={}", e.getName(), e.getValue());
        return badRequest("값의 형식이 올바르지 않습니다: " + e.getName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleMessageNotReadableException(HttpMessageNotReadableException e) {
        log.warn("HttpMessageNotReadableException: {}", e.getMessage());
        return badRequest("요청 본문을 읽을 수 없습니다");
    }

    /**
     * IllegalArgumentException 처리
     * 잘못된 인자가 전달된 경우 발생합니다.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("IllegalArgumentException: {}", e.getMessage());
        return badRequest(e.getMessage());
    }

    /**
     * 그 외 모든 예외 처리
     * 예상하지 못한 예외가 발생한 경우입니다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("UnexpectedException: ", e);

        ApiResponse<Void> response = ApiResponse.fail(ResponseCode.INTERNAL_SERVER_ERROR);
        return ResponseEntity
                .status(ResponseCode.INTERNAL_SERVER_ERROR.getHttpStatus())
                .body(response);
    }

    private ResponseEntity<ApiResponse<Void>> badRequest(String message) {
        ApiResponse<Void> response = ApiResponse.fail(ResponseCode.BAD_REQUEST, message);
        return ResponseEntity
                .status(ResponseCode.BAD_REQUEST.getHttpStatus())
                .body(response);
    }

    private ResponseEntity<ApiResponse<Void>> failure(ResponseCode code, String message, String reason) {
        ApiResponse<Void> response = ApiResponse.fail(code, message, reason);
        return ResponseEntity
                .status(code.getHttpStatus())
                .body(response);
    }

    private static ResponseCode toResponseCode(IssueFailure failure) {
        return switch (failure) {
            case BENEFIT_NOT_FOUND -> ResponseCode.BENEFIT_NOT_FOUND;
            case BENEFIT_INACTIVE -> ResponseCode.BENEFIT_INACTIVE;
            case OUT_OF_VALIDITY_WINDOW -> ResponseCode.BENEFIT_OUT_OF_VALIDITY;
            case STUDENT_ONLY -> ResponseCode.BENEFIT_STUDENT_ONLY;
            case DUPLICATE_ACTIVE_COUPON -> ResponseCode.COUPON_DUPLICATE_ACTIVE;
        };
    }

    private static ResponseCode toResponseCode(ValidationFailure failure) {
        return switch (failure) {
            case NOT_FOUND, AMBIGUOUS_OR_NOT_FOUND -> ResponseCode.COUPON_NOT_FOUND;
            case ALREADY_REDEEMED -> ResponseCode.COUPON_ALREADY_USED;
            case EXPIRED -> ResponseCode.COUPON_EXPIRED;
            default -> ResponseCode.COUPON_NOT_REDEEMABLE;
        };
    }
}
