package com.backoffice.interfaces.controller;

import com.backoffice.application.dto.OrderCreateRequest;
import com.backoffice.application.dto.OrderCreateRequest.OrderItemRequest;
import com.backoffice.application.dto.OrderResponse;
import com.backoffice.application.dto.OrderStatusUpdateRequest;
import com.backoffice.application.service.OrderService;
import com.backoffice.domain.entity.OrderStatus;
import com.backoffice.domain.entity.PaymentStatus;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OrderController.class)
@DisplayName("OrderController 테스트")
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private OrderService orderService;

    private OrderResponse orderResponse(OrderStatus status) {
        LocalDateTime now = LocalDateTime.now();
        return new OrderResponse(100L, "ORD-0000000100", 1L,
                new BigDecimal("69.97"), new BigDecimal("7.00"), new BigDecimal("62.97"), 3L,
                status, PaymentStatus.PENDING, now, now);
    }

    @Test
    @DisplayName("주문을 생성한다")
    void createOrder() throws Exception {
        // given
        OrderCreateRequest request = new OrderCreateRequest(1L,
                List.of(new OrderItemRequest(10L, 2, new BigDecimal("29.99"))), "SAVE10");
        when(orderService.createOrder(any(OrderCreateRequest.class))).thenReturn(orderResponse(OrderStatus.PENDING));

        // when & then
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.code").value("ORDER_3001"))
                .andExpect(jsonPath("$.data.orderNumber").value("ORD-0000000100"))
                .andExpect(jsonPath("$.data.finalAmount").value(62.97))
                .andExpect(jsonPath("$.data.status").value("PENDING"));
    }

    @Test
    @DisplayName("주문 항목이 비어 있으면 400을 반환한다")
    void createOrder_EmptyItems() throws Exception {
        // given
        OrderCreateRequest request = new OrderCreateRequest(1L, List.of(), null);

        // when & then
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("COMMON_1400"));
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("수량이 0이면 400을 반환한다")
    void createOrder_ZeroQuantity() throws Exception {
        // given
        OrderCreateRequest request = new OrderCreateRequest(1L,
                List.of(new OrderItemRequest(10L, 0, new BigDecimal("29.99"))), null);

        // when & then
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON_1400"));
    }

    @Test
    @DisplayName("재고가 부족하면 비즈니스 오류 코드를 반환한다")
    void createOrder_OutOfStock() throws Exception {
        // given
        OrderCreateRequest request = new OrderCreateRequest(1L,
                List.of(new OrderItemRequest(10L, 99, new BigDecimal("29.99"))), null);
        when(orderService.createOrder(any(OrderCreateRequest.class)))
                .thenThrow(new BusinessException(ResponseCode.PRODUCT_OUT_OF_STOCK));

        // when & then
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PRODUCT_2002"));
    }

    @Test
    @DisplayName("본문 없이 주문을 취소한다")
    void cancelOrder_WithoutBody() throws Exception {
        // given
        when(orderService.cancelOrder(eq(100L), isNull())).thenReturn(orderResponse(OrderStatus.CANCELLED));

        // when & then
        mockMvc.perform(post("/api/orders/100/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("ORDER_3005"))
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("존재하지 않는 주문을 조회하면 성공 응답에 data가 null이다")
    void getOrder_NotFound() throws Exception {
        // given
        when(orderService.getOrder(999L)).thenReturn(null);

        // when & then
        mockMvc.perform(get("/api/orders/999"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("ORDER_3000"))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    @DisplayName("존재하지 않는 주문을 취소하면 404를 반환한다")
    void cancelOrder_NotFound() throws Exception {
        // given
        when(orderService.cancelOrder(eq(999L), eq(1L)))
                .thenThrow(new BusinessException(ResponseCode.ORDER_NOT_FOUND));

        // when & then
        mockMvc.perform(post("/api/orders/999/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":1}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ORDER_3002"));
    }

    @Test
    @DisplayName("주문 상태를 변경한다")
    void updateOrderStatus() throws Exception {
        // given
        when(orderService.updateOrderStatus(100L, OrderStatus.PROCESSING))
                .thenReturn(orderResponse(OrderStatus.PROCESSING));

        // when & then
        mockMvc.perform(patch("/api/orders/100/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new OrderStatusUpdateRequest(OrderStatus.PROCESSING))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("PROCESSING"));
    }

    @Test
    @DisplayName("알 수 없는 상태 값은 400을 반환한다")
    void updateOrderStatus_UnknownStatus() throws Exception {
        // when & then
        mockMvc.perform(patch("/api/orders/100/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"SHIPPED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON_1400"));
    }

    @Test
    @DisplayName("조건으로 주문 목록을 조회한다")
    void getOrders() throws Exception {
        // given
        when(orderService.getOrders(1L, OrderStatus.PENDING, null, 10, 0))
                .thenReturn(List.of(orderResponse(OrderStatus.PENDING)));

        // when & then
        mockMvc.perform(get("/api/orders")
                        .param("userId", "1")
                        .param("status", "PENDING")
                        .param("limit", "10")
                        .param("offset", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].orderId").value(100L))
                .andExpect(jsonPath("$.data.length()").value(1));
    }
}
