package com.benefitcoupon.api;

import com.benefitcoupon.application.dto.CouponIssueRequest;
import com.benefitcoupon.application.dto.CouponRedeemRequest;
import com.benefitcoupon.application.dto.CouponResponse;
import com.benefitcoupon.application.dto.CouponStatsResponse;
import com.benefitcoupon.application.dto.CouponValidationResponse;
import com.benefitcoupon.application.dto.RedemptionResponse;
import com.benefitcoupon.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Coupon", description = "쿠폰 발급/사용 API")
@RequestMapping("/api/coupons")
public interface CouponApi {

    @Operation(summary = "쿠폰 발급", description = "혜택에 대한 10분 유효 쿠폰(토큰 + 4자리 PIN)을 발급합니다.")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    ApiResponse<CouponResponse> issueCoupon(
            @Parameter(description = "사용자 ID", required = true, example = "1")
            @RequestHeader("X-User-Id") Long userId,
            @Parameter(description = "사용자 역할 (쉼표 구분)", example = "USER,STUDENT")
            @RequestHeader(value = "X-User-Roles", required = false) String roles,
            @Parameter(description = "단말 ID", example = "device-abc")
            @RequestHeader(value = "X-Device-Id", required = false) String deviceId,
            @RequestHeader(value = "User-Agent", required = false) String userAgent,
            @Valid @RequestBody CouponIssueRequest request,
            @Parameter(hidden = true) HttpServletRequest servletRequest
    );

    @Operation(summary = "쿠폰 사용", description = "가맹점에서 토큰 또는 PIN으로 쿠폰을 사용 처리합니다.")
    @PostMapping("/redeem")
    ApiResponse<RedemptionResponse> redeemCoupon(
            @Parameter(description = "처리 직원 ID", example = "10")
            @RequestHeader(value = "X-Staff-Id", required = false) Long staffId,
            @Parameter(description = "단말 ID", example = "pos-01")
            @RequestHeader(value = "X-Device-Id", required = false) String deviceId,
            @Valid @RequestBody CouponRedeemRequest request,
            @Parameter(hidden = true) HttpServletRequest servletRequest
    );

    @Operation(summary = "쿠폰 사용 가능 여부 확인", description = "쿠폰 상태를 바꾸지 않고 검증만 수행합니다.")
    @GetMapping("/validate/{token}")
    ApiResponse<CouponValidationResponse> validateCoupon(
            @Parameter(description = "쿠폰 토큰", required = true)
            @PathVariable String token,
            @Parameter(description = "가맹점 ID", required = true, example = "1")
            @RequestParam Long merchantId,
            @Parameter(description = "현재 위치 (\"lat,lng\" 또는 \"POINT(lng lat)\")", example = "33.4996,126.5312")
            @RequestParam(required = false) String location
    );

    @Operation(summary = "쿠폰 통계", description = "발급/사용/만료 수와 사용률을 조회합니다.")
    @GetMapping("/stats")
    ApiResponse<CouponStatsResponse> getCouponStats(
            @Parameter(description = "혜택 ID (없으면 전체)", example = "1")
            @RequestParam(required = false) Long benefitId
    );
}
