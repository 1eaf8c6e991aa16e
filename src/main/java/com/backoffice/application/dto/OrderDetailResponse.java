package com.backoffice.application.dto;

import com.backoffice.domain.entity.Coupon;
import com.backoffice.domain.entity.DiscountType;
import com.backoffice.domain.entity.Order;
import com.backoffice.domain.entity.User;

import java.math.BigDecimal;
import java.util.List;

public record OrderDetailResponse(
    OrderResponse order,
    UserSummary user,
    List<OrderItemResponse> items,
    CouponSummary coupon
) {

    public static OrderDetailResponse of(Order order, User user, List<OrderItemResponse> items, Coupon coupon) {
        return new OrderDetailResponse(
            OrderResponse.from(order),
            user != null ? UserSummary.from(user) : null,
            items,
            coupon != null ? CouponSummary.from(coupon) : null
        );
    }

    public record UserSummary(Long userId, String email, String firstName, String lastName) {

        static UserSummary from(User user) {
            return new UserSummary(user.getId(), user.getEmail(), user.getFirstName(), user.getLastName());
        }
    }

    public record CouponSummary(Long couponId, String code, DiscountType type, BigDecimal value) {

        static CouponSummary from(Coupon coupon) {
            return new CouponSummary(coupon.getId(), coupon.getCode(), coupon.getDiscountType(), coupon.getValue());
        }
    }
}
