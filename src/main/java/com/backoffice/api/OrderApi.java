package com.backoffice.api;

import com.backoffice.application.dto.*;
import com.backoffice.domain.entity.OrderStatus;
import com.backoffice.domain.entity.PaymentStatus;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Order", description = "주문 API")
@RequestMapping("/api/orders")
public interface OrderApi {

    @Operation(summary = "주문 생성",
            description = "상품 가격/재고와 쿠폰을 검증한 뒤 주문을 생성하고 재고를 차감합니다.")
    @PostMapping
    ApiResponse<OrderResponse> createOrder(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "주문 생성 요청", required = true)
            @Valid @RequestBody OrderCreateRequest request
    );

    @Operation(summary = "주문 취소", description = "주문을 취소하고 재고를 복구합니다. userId를 주면 본인 주문만 취소합니다.")
    @PostMapping("/{orderId}/cancel")
    ApiResponse<OrderResponse> cancelOrder(
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable Long orderId,
            @RequestBody(required = false) OrderCancelRequest request
    );

    @Operation(summary = "주문 상태 변경", description = "허용된 전이만 가능합니다. CANCELLED는 취소 처리와 동일합니다.")
    @PatchMapping("/{orderId}/status")
    ApiResponse<OrderResponse> updateOrderStatus(
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable Long orderId,
            @Valid @RequestBody OrderStatusUpdateRequest request
    );

    @Operation(summary = "결제 상태 변경", description = "허용된 결제 상태 전이만 가능합니다.")
    @PatchMapping("/{orderId}/payment-status")
    ApiResponse<OrderResponse> updatePaymentStatus(
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable Long orderId,
            @Valid @RequestBody PaymentStatusUpdateRequest request
    );

    @Operation(summary = "주문 목록 조회", description = "조건에 맞는 주문을 최신순으로 조회합니다.")
    @GetMapping
    ApiResponse<List<OrderResponse>> getOrders(
            @Parameter(description = "사용자 ID") @RequestParam(required = false) Long userId,
            @Parameter(description = "주문 상태") @RequestParam(required = false) OrderStatus status,
            @Parameter(description = "결제 상태") @RequestParam(required = false) PaymentStatus paymentStatus,
            @Parameter(description = "조회 개수 (기본 20, 최대 100)") @RequestParam(required = false) Integer limit,
            @Parameter(description = "건너뛸 개수 (기본 0)") @RequestParam(required = false) Integer offset
    );

    @Operation(summary = "주문 상세 조회", description = "주문, 주문자, 주문 항목, 적용 쿠폰을 조회합니다. 주문이 없으면 data가 null입니다.")
    @GetMapping("/{orderId}")
    ApiResponse<OrderDetailResponse> getOrder(
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable Long orderId
    );

    @Operation(summary = "사용자 주문 이력 조회", description = "특정 사용자의 주문과 주문 항목을 조회합니다.")
    @GetMapping("/users/{userId}")
    ApiResponse<List<OrderHistoryResponse>> getUserOrders(
            @Parameter(description = "사용자 ID", required = true, example = "1")
            @PathVariable Long userId
    );
}
