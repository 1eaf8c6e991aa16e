package com.backoffice.domain.service;

import com.backoffice.domain.entity.Order;
import com.backoffice.domain.entity.OrderItem;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.repository.OrderItemRepository;
import com.backoffice.domain.repository.OrderRepository;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 주문 도메인 서비스
 *
 * 책임:
 * - 주문 라인 검증 (상품 존재, 가격 일치, 재고)
 * - 주문 헤더와 주문 항목 생성
 *
 * 주의:
 * - 다른 도메인 서비스에 의존하지 않음
 * - 재고 차감, 쿠폰 사용은 상위 Application Service에서 조율
 */
@Service
@RequiredArgsConstructor
public class OrderDomainService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    /**
     * 주문 라인을 입력 순서대로 검증하고 할인 전 주문 금액을 반환합니다.
     * 같은 상품이 여러 줄에 나오면 수량을 누적해서 재고와 비교합니다.
     *
     * @param lines    주문 라인
     * @param products 락을 획득한 상품 (ID 기준)
     * @return 라인 금액의 합
     */
    public Money validateLines(List<OrderLine> lines, Map<Long, Product> products) {
        if (lines == null || lines.isEmpty()) {
            throw new BusinessException(ResponseCode.BAD_REQUEST, "주문 상품이 비어 있습니다");
        }

        Map<Long, Integer> requested = new HashMap<>();
        Money total = Money.zero();

        for (OrderLine line : lines) {
            Product product = products.get(line.productId());
            if (product == null || !product.isActive()) {
                throw new BusinessException(ResponseCode.PRODUCT_NOT_FOUND,
                        "상품을 찾을 수 없습니다: id=" + line.productId());
            }
            if (!product.matchesPrice(line.price())) {
                throw new BusinessException(ResponseCode.ORDER_PRICE_MISMATCH,
                        "가격 불일치: 상품 " + product.getName() + " 현재 가격 " + product.getPrice()
                                + ", 요청 가격 " + line.price());
            }

            int cumulative = requested.merge(line.productId(), line.quantity(), Integer::sum);
            if (!product.hasStock(cumulative)) {
                throw new BusinessException(ResponseCode.PRODUCT_OUT_OF_STOCK,
                        "재고 부족: 상품 " + product.getName() + " 현재 재고 " + product.getStockQuantity()
                                + "개, 요청 수량 " + cumulative + "개");
            }

            total = total.add(line.lineTotal());
        }
        return total;
    }

    /**
     * 주문 헤더를 저장하고 발급된 ID로 주문 번호를 부여합니다.
     */
    public Order createOrder(Long userId, Money totalAmount, Money discountAmount, Long couponId) {
        Order order = new Order(userId, totalAmount, discountAmount, couponId);
        orderRepository.save(order);
        order.assignOrderNumber();
        return orderRepository.save(order);
    }

    /**
     * 주문 라인마다 상품명과 단가 스냅샷을 가진 주문 항목을 저장합니다.
     */
    public List<OrderItem> createOrderItems(Order order, List<OrderLine> lines, Map<Long, Product> products) {
        List<OrderItem> orderItems = lines.stream()
                .map(line -> new OrderItem(order.getId(), products.get(line.productId()),
                        line.quantity(), line.unitPrice()))
                .toList();
        return orderItemRepository.saveAll(orderItems);
    }
}
