package com.backoffice.api;

import com.backoffice.application.dto.CartItemAddRequest;
import com.backoffice.application.dto.CartItemResponse;
import com.backoffice.application.dto.CartItemUpdateRequest;
import com.backoffice.application.dto.CartSummaryResponse;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Cart", description = "장바구니 API")
@RequestMapping("/api/carts/users/{userId}")
public interface CartApi {

    @Operation(summary = "장바구니 담기", description = "이미 담긴 상품이면 수량을 합칩니다.")
    @PostMapping
    ApiResponse<CartItemResponse> addItem(
            @Parameter(description = "사용자 ID", required = true, example = "1") @PathVariable Long userId,
            @Valid @RequestBody CartItemAddRequest request
    );

    @Operation(summary = "장바구니 조회")
    @GetMapping
    ApiResponse<List<CartItemResponse>> getItems(
            @Parameter(description = "사용자 ID", required = true, example = "1") @PathVariable Long userId
    );

    @Operation(summary = "장바구니 수량 변경")
    @PatchMapping("/items/{cartItemId}")
    ApiResponse<CartItemResponse> updateQuantity(
            @Parameter(description = "사용자 ID", required = true, example = "1") @PathVariable Long userId,
            @Parameter(description = "장바구니 항목 ID", required = true, example = "10") @PathVariable Long cartItemId,
            @Valid @RequestBody CartItemUpdateRequest request
    );

    @Operation(summary = "장바구니 항목 삭제")
    @DeleteMapping("/items/{cartItemId}")
    ApiResponse<Void> removeItem(
            @Parameter(description = "사용자 ID", required = true, example = "1") @PathVariable Long userId,
            @Parameter(description = "장바구니 항목 ID", required = true, example = "10") @PathVariable Long cartItemId
    );

    @Operation(summary = "장바구니 비우기")
    @DeleteMapping
    ApiResponse<Void> clear(
            @Parameter(description = "사용자 ID", required = true, example = "1") @PathVariable Long userId
    );

    @Operation(summary = "장바구니 합계 조회")
    @GetMapping("/summary")
    ApiResponse<CartSummaryResponse> getSummary(
            @Parameter(description = "사용자 ID", required = true, example = "1") @PathVariable Long userId
    );
}
