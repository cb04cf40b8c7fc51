package com.benefitcoupon.interfaces.controller;

import com.benefitcoupon.api.UserCouponApi;
import com.benefitcoupon.application.dto.CouponResponse;
import com.benefitcoupon.application.service.CouponService;
import com.benefitcoupon.dto.ApiResponse;
import com.benefitcoupon.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class UserCouponController implements UserCouponApi {

    private final CouponService couponService;

    @Override
    public ApiResponse<List<CouponResponse>> getUserCoupons(Long userId, String status) {
        return ApiResponse.of(ResponseCode.COUPON_SUCCESS, couponService.getUserCoupons(userId, status));
    }
}
