package com.backoffice.interfaces.controller;

import com.backoffice.api.OrderApi;
import com.backoffice.application.dto.*;
import com.backoffice.application.service.OrderService;
import com.backoffice.domain.entity.OrderStatus;
import com.backoffice.domain.entity.PaymentStatus;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class OrderController implements OrderApi {

    private final OrderService orderService;

    @Override
    public ApiResponse<OrderResponse> createOrder(OrderCreateRequest request) {
        return ApiResponse.of(ResponseCode.ORDER_CREATED, orderService.createOrder(request));
    }

    @Override
    public ApiResponse<OrderResponse> cancelOrder(Long orderId, OrderCancelRequest request) {
        Long userId = request != null ? request.userId() : null;
        return ApiResponse.of(ResponseCode.ORDER_CANCELLED, orderService.cancelOrder(orderId, userId));
    }

    @Override
    public ApiResponse<OrderResponse> updateOrderStatus(Long orderId, OrderStatusUpdateRequest request) {
        return ApiResponse.of(ResponseCode.ORDER_STATUS_UPDATED,
                orderService.updateOrderStatus(orderId, request.status()));
    }

    @Override
    public ApiResponse<OrderResponse> updatePaymentStatus(Long orderId, PaymentStatusUpdateRequest request) {
        return ApiResponse.of(ResponseCode.ORDER_STATUS_UPDATED,
                orderService.updatePaymentStatus(orderId, request.paymentStatus()));
    }

    @Override
    public ApiResponse<List<OrderResponse>> getOrders(Long userId, OrderStatus status, PaymentStatus paymentStatus,
                                                      Integer limit, Integer offset) {
        return ApiResponse.of(ResponseCode.ORDER_SUCCESS,
                orderService.getOrders(userId, status, paymentStatus, limit, offset));
    }

    @Override
    public ApiResponse<OrderDetailResponse> getOrder(Long orderId) {
        return ApiResponse.of(ResponseCode.ORDER_SUCCESS, orderService.getOrder(orderId));
    }

    @Override
    public ApiResponse<List<OrderHistoryResponse>> getUserOrders(Long userId) {
        return ApiResponse.of(ResponseCode.ORDER_SUCCESS, orderService.getUserOrders(userId));
    }
}
