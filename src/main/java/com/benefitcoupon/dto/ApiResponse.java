package com.benefitcoupon.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "공통 API 응답")
public class ApiResponse<T> {

    @Schema(description = "성공 여부", example = "true")
    private boolean success;

    @Schema(description = "응답 코드", example = "COMMON_1000")
    private String code;

    @Schema(description = "응답 데이터")
    private T data;

    @Schema(description = "메시지", example = "요청이 성공적으로 처리되었습니다.")
    private String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "실패 사유 (실패 시에만)", example = "QuotaExceeded(user)")
    private String error;

    public static <T> ApiResponse<T> of(ResponseCode responseCode, T data) {
        return new ApiResponse<>(true, responseCode.getCode(), data, responseCode.getMessage(), null);
    }

    public static <T> ApiResponse<T> fail(ResponseCode responseCode) {
        return new ApiResponse<>(false, responseCode.getCode(), null, responseCode.getMessage(), null);
    }

    public static <T> ApiResponse<T> fail(ResponseCode responseCode, String customMessage) {
        return new ApiResponse<>(false, responseCode.getCode(), null, customMessage, null);
    }

    // 실패 사유 문자열 포함
    public static <T> ApiResponse<T> fail(ResponseCode responseCode, String customMessage, String error) {
        return new ApiResponse<>(false, responseCode.getCode(), null, customMessage, error);
    }
}
