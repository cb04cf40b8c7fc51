package com.benefitcoupon.api;

import com.benefitcoupon.application.dto.CouponResponse;
import com.benefitcoupon.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "User Coupon", description = "사용자 쿠폰 API")
@RequestMapping("/api/users")
public interface UserCouponApi {

    @Operation(summary = "사용자 쿠폰 목록 조회", description = "상태(active, used, expired)로 필터링할 수 있습니다.")
    @GetMapping("/{userId}/coupons")
    ApiResponse<List<CouponResponse>> getUserCoupons(
            @Parameter(description = "사용자 ID", required = true, example = "1")
            @PathVariable Long userId,
            @Parameter(description = "쿠폰 상태", example = "active")
            @RequestParam(required = false) String status
    );
}
