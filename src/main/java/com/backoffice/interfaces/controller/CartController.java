package com.backoffice.interfaces.controller;

import com.backoffice.api.CartApi;
import com.backoffice.application.dto.CartItemAddRequest;
import com.backoffice.application.dto.CartItemResponse;
import com.backoffice.application.dto.CartItemUpdateRequest;
import com.backoffice.application.dto.CartSummaryResponse;
import com.backoffice.application.service.CartService;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class CartController implements CartApi {

    private final CartService cartService;

    @Override
    public ApiResponse<CartItemResponse> addItem(Long userId, CartItemAddRequest request) {
        return ApiResponse.of(ResponseCode.CART_ITEM_ADDED, cartService.addItem(userId, request));
    }

    @Override
    public ApiResponse<List<CartItemResponse>> getItems(Long userId) {
        return ApiResponse.of(ResponseCode.CART_SUCCESS, cartService.getItems(userId));
    }

    @Override
    public ApiResponse<CartItemResponse> updateQuantity(Long userId, Long cartItemId, CartItemUpdateRequest request) {
        return ApiResponse.of(ResponseCode.CART_ITEM_UPDATED, cartService.updateQuantity(userId, cartItemId, request));
    }

    @Override
    public ApiResponse<Void> removeItem(Long userId, Long cartItemId) {
        cartService.removeItem(userId, cartItemId);
        return ApiResponse.of(ResponseCode.CART_ITEM_REMOVED, null);
    }

    @Override
    public ApiResponse<Void> clear(Long userId) {
        cartService.clear(userId);
        return ApiResponse.of(ResponseCode.CART_CLEARED, null);
    }

    @Override
    public ApiResponse<CartSummaryResponse> getSummary(Long userId) {
        return ApiResponse.of(ResponseCode.CART_SUCCESS, cartService.getSummary(userId));
    }
}
