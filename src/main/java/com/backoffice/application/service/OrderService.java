package com.backoffice.application.service;

import com.backoffice.application.dto.*;
import com.backoffice.application.event.DomainEventPublisher;
import com.backoffice.application.event.OrderCancelledEvent;
import com.backoffice.application.event.OrderCreatedEvent;
import com.backoffice.domain.entity.*;
import com.backoffice.domain.repository.*;
import com.backoffice.domain.service.*;
import com.backoffice.domain.service.CouponDomainService.AppliedCoupon;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 주문 Application 서비스
 *
 * 책임:
 * - 주문 생성/취소/상태 변경의 트랜잭션 경계
 * - 여러 도메인 서비스의 조율 (Orchestration)
 * - DTO 변환
 *
 * 동시성:
 * - 상품, 쿠폰, 주문 행을 비관적 쓰기 락으로 조회하여 같은 트랜잭션 안에서 갱신
 * - 상품 락은 ID 오름차순으로 획득
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final ProductRepository productRepository;
    private final CouponRepository couponRepository;

    private final OrderDomainService orderDomainService;
    private final ProductDomainService productDomainService;
    private final CouponDomainService couponDomainService;
    private final DomainEventPublisher eventPublisher;

    /**
     * 주문 생성
     *
     * 검증 순서: 사용자 → 주문 라인(입력 순서, 상품/가격/재고) → 쿠폰.
     * 주문 저장, 쿠폰 사용 횟수 증가, 재고 차감은 하나의 트랜잭션으로 처리되며
     * 어느 단계에서든 실패하면 전체가 롤백됩니다.
     */
    @Transactional
    public OrderResponse createOrder(OrderCreateRequest request) {
        User user = userRepository.getActiveByIdOrThrow(request.userId());
        List<OrderLine> lines = toOrderLines(request.items());

        Map<Long, Product> products = productDomainService.lockProducts(
                lines.stream().map(OrderLine::productId).toList());
        Money totalAmount = orderDomainService.validateLines(lines, products);

        AppliedCoupon appliedCoupon = null;
        Money discountAmount = Money.zero();
        if (StringUtils.hasText(request.couponCode())) {
            appliedCoupon = couponDomainService.applyToOrder(request.couponCode(), totalAmount);
            discountAmount = appliedCoupon.discount();
        }

        Order order = orderDomainService.createOrder(
                user.getId(),
                totalAmount,
                discountAmount,
                appliedCoupon != null ? appliedCoupon.couponId() : null
        );
        List<OrderItem> orderItems = orderDomainService.createOrderItems(order, lines, products);

        if (appliedCoupon != null) {
            couponDomainService.redeem(appliedCoupon.coupon());
        }
        for (OrderLine line : lines) {
            productDomainService.reduceStock(products.get(line.productId()), line.quantity());
        }

        log.info("주문 생성: orderId={}, userId={}, total={}, discount={}, final={}",
                order.getId(), user.getId(), order.getTotalAmount(), order.getDiscountAmount(),
                order.getFinalAmount());

        eventPublisher.publish(new OrderCreatedEvent(
                order.getId(),
                order.getOrderNumber(),
                order.getUserId(),
                order.getFinalAmount(),
                order.getCouponId(),
                orderItems.size()
        ));

        return OrderResponse.from(order);
    }

    private List<OrderLine> toOrderLines(List<OrderCreateRequest.OrderItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ResponseCode.BAD_REQUEST, "주문 항목은 최소 1개 이상이어야 합니다");
        }
        return items.stream()
                .map(item -> new OrderLine(
                        item.productId(),
                        item.quantity() != null ? item.quantity() : 0,
                        requireMoneyScale(item.price())))
                .toList();
    }

    private BigDecimal requireMoneyScale(BigDecimal price) {
        if (price != null && price.stripTrailingZeros().scale() > Money.SCALE) {
            throw new BusinessException(ResponseCode.BAD_REQUEST,
                    "가격은 소수점 둘째 자리까지 입력할 수 있습니다: " + price.toPlainString());
        }
        return price;
    }

    /**
     * 주문 취소
     *
     * userId가 주어지면 해당 사용자의 주문만 취소할 수 있으며,
     * 다른 사용자의 주문은 존재하지 않는 주문과 동일하게 응답합니다.
     * 상태 변경과 재고 복구는 같은 트랜잭션에서 처리됩니다. 쿠폰 사용 횟수는 되돌리지 않습니다.
     */
    @Transactional
    public OrderResponse cancelOrder(Long orderId, Long userId) {
        Order order = orderRepository.findByIdWithLock(orderId)
                .filter(found -> userId == null || found.isOwnedBy(userId))
                .orElseThrow(() -> new BusinessException(ResponseCode.ORDER_NOT_FOUND));

        order.cancel();
        orderRepository.save(order);

        List<OrderItem> orderItems = orderItemRepository.findByOrderId(order.getId());
        int restored = productDomainService.restoreStock(orderItems);

        log.info("주문 취소: orderId={}, restoredItems={}", order.getId(), restored);

        eventPublisher.publish(new OrderCancelledEvent(
                order.getId(),
                order.getOrderNumber(),
                order.getUserId(),
                restored
        ));

        return OrderResponse.from(order);
    }

    /**
     * 주문 상태 변경. CANCELLED로의 변경은 재고 복구를 위해 취소 경로로 처리합니다.
     */
    @Transactional
    public OrderResponse updateOrderStatus(Long orderId, OrderStatus status) {
        if (status == OrderStatus.CANCELLED) {
            return cancelOrder(orderId, null);
        }

        Order order = orderRepository.getByIdWithLockOrThrow(orderId);
        OrderStatus previous = order.getStatus();
        order.changeStatus(status);
        orderRepository.save(order);

        log.info("주문 상태 변경: orderId={}, {} -> {}", orderId, previous, status);
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse updatePaymentStatus(Long orderId, PaymentStatus paymentStatus) {
        Order order = orderRepository.getByIdWithLockOrThrow(orderId);
        PaymentStatus previous = order.getPaymentStatus();
        order.changePaymentStatus(paymentStatus);
        orderRepository.save(order);

        log.info("결제 상태 변경: orderId={}, {} -> {}", orderId, previous, paymentStatus);
        return OrderResponse.from(order);
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> getOrders(Long userId, OrderStatus status, PaymentStatus paymentStatus,
                                         Integer limit, Integer offset) {
        OrderSearchCondition condition = new OrderSearchCondition(
                userId, status, paymentStatus, normalizeLimit(limit), normalizeOffset(offset));
        return orderRepository.search(condition).stream()
                .map(OrderResponse::from)
                .toList();
    }

    static int normalizeLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    static int normalizeOffset(Integer offset) {
        return offset == null ? 0 : Math.max(0, offset);
    }

    /**
     * 주문 상세 조회. 주문이 없으면 null을 반환합니다.
     */
    @Transactional(readOnly = true)
    public OrderDetailResponse getOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .map(this::toDetailResponse)
                .orElse(null);
    }

    private OrderDetailResponse toDetailResponse(Order order) {
        Long orderId = order.getId();
        List<OrderItem> orderItems = orderItemRepository.findByOrderId(orderId);
        Map<Long, Product> products = findProducts(orderItems);

        User user = userRepository.findById(order.getUserId()).orElse(null);
        Coupon coupon = order.getCouponId() != null
                ? couponRepository.findById(order.getCouponId()).orElse(null)
                : null;

        return OrderDetailResponse.of(order, user, toItemResponses(orderItems, products), coupon);
    }

    /**
     * 사용자의 주문 이력. 주문 항목과 상품은 각각 한 번의 쿼리로 조회합니다.
     */
    @Transactional(readOnly = true)
    public List<OrderHistoryResponse> getUserOrders(Long userId) {
        List<Order> orders = orderRepository.findByUserId(userId);
        if (orders.isEmpty()) {
            return List.of();
        }

        List<Long> orderIds = orders.stream()
                .map(Order::getId)
                .toList();
        List<OrderItem> allOrderItems = orderItemRepository.findByOrderIdIn(orderIds);
        Map<Long, Product> products = findProducts(allOrderItems);

        Map<Long, List<OrderItem>> orderItemsMap = allOrderItems.stream()
                .collect(Collectors.groupingBy(OrderItem::getOrderId));

        return orders.stream()
                .map(order -> OrderHistoryResponse.of(order,
                        toItemResponses(orderItemsMap.getOrDefault(order.getId(), List.of()), products)))
                .toList();
    }

    private Map<Long, Product> findProducts(Collection<OrderItem> orderItems) {
        List<Long> productIds = orderItems.stream()
                .map(OrderItem::getProductId)
                .distinct()
                .toList();
        return productRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
    }

    private List<OrderItemResponse> toItemResponses(List<OrderItem> orderItems, Map<Long, Product> products) {
        return orderItems.stream()
                .map(item -> OrderItemResponse.of(item, products.get(item.getProductId())))
                .toList();
    }
}
