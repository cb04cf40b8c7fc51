package com.benefitcoupon.interfaces.controller;

import com.benefitcoupon.api.CouponApi;
import com.benefitcoupon.application.dto.CouponIssueRequest;
import com.benefitcoupon.application.dto.CouponRedeemRequest;
import com.benefitcoupon.application.dto.CouponResponse;
import com.benefitcoupon.application.dto.CouponStatsResponse;
import com.benefitcoupon.application.dto.CouponValidationResponse;
import com.benefitcoupon.application.dto.RedemptionResponse;
import com.benefitcoupon.application.service.CouponService;
import com.benefitcoupon.domain.service.IssueCommand;
import com.benefitcoupon.domain.service.RedeemCommand;
import com.benefitcoupon.domain.vo.IssueMetadata;
import com.benefitcoupon.dto.ApiResponse;
import com.benefitcoupon.dto.ResponseCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;

@RestController
@RequiredArgsConstructor
public class CouponController implements CouponApi {

    private static final String ROLE_STUDENT = "STUDENT";

    private final CouponService couponService;

    @Override
    public ApiResponse<CouponResponse> issueCoupon(Long userId, String roles, String deviceId, String userAgent,
                                                   CouponIssueRequest request, HttpServletRequest servletRequest) {
        IssueCommand command = new IssueCommand(
                userId,
                request.benefitId(),
                hasRole(roles, ROLE_STUDENT),
                new IssueMetadata(deviceId, userAgent, servletRequest.getRemoteAddr())
        );
        return ApiResponse.of(ResponseCode.COUPON_ISSUED, couponService.issueCoupon(command));
    }

    @Override
    public ApiResponse<RedemptionResponse> redeemCoupon(Long staffId, String deviceId, CouponRedeemRequest request,
                                                        HttpServletRequest servletRequest) {
        RedeemCommand command = new RedeemCommand(
                request.token(),
                request.pin(),
                request.merchantId(),
                request.location() != null ? request.location().toGeoPoint() : null,
                staffId,
                deviceId,
                servletRequest.getRemoteAddr()
        );
        return ApiResponse.of(ResponseCode.COUPON_REDEEMED, couponService.redeemCoupon(command));
    }

    @Override
    public ApiResponse<CouponValidationResponse> validateCoupon(String token, Long merchantId, String location) {
        return ApiResponse.of(ResponseCode.COUPON_VALIDATED, couponService.validateCoupon(token, merchantId, location));
    }

    @Override
    public ApiResponse<CouponStatsResponse> getCouponStats(Long benefitId) {
        return ApiResponse.of(ResponseCode.COUPON_SUCCESS, couponService.getCouponStats(benefitId));
    }

    private static boolean hasRole(String roles, String role) {
        if (roles == null || roles.isBlank()) {
            return false;
        }
        return Arrays.stream(roles.split(","))
                .map(String::trim)
                .anyMatch(role::equalsIgnoreCase);
    }
}
