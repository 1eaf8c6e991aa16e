package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 주문 Entity
 *
 * 금액은 주문 시점의 스냅샷이므로 이후 상품 가격이나 쿠폰이 바뀌어도 변하지 않습니다.
 * OrderItem과 쿠폰은 간접 참조(ID 기반)로 관리합니다.
 * 상태 변경은 {@link OrderStatus}의 전이 규칙을 통과해야 합니다.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_user_id", columnList = "user_id"),
        @Index(name = "idx_orders_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order extends BaseTimeEntity {

    @Column(name = "order_number", nullable = false, unique = true, length = 50)
    private String orderNumber;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private Money totalAmount;

    @Column(name = "discount_amount", nullable = false, precision = 10, scale = 2)
    private Money discountAmount;

    @Column(name = "final_amount", nullable = false, precision = 10, scale = 2)
    private Money finalAmount;

    @Column(name = "coupon_id")
    private Long couponId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    public Order(Long userId, Money totalAmount, Money discountAmount, Long couponId) {
        validateConstructorParams(userId, totalAmount, discountAmount);

        this.userId = userId;
        this.orderNumber = "ORD-TEMP-" + System.nanoTime();
        this.totalAmount = totalAmount;
        this.discountAmount = discountAmount;
        this.finalAmount = totalAmount.subtract(discountAmount);
        this.couponId = couponId;
        this.status = OrderStatus.PENDING;
        this.paymentStatus = PaymentStatus.PENDING;
        initializeTimestamps();
    }

    private void validateConstructorParams(Long userId, Money totalAmount, Money discountAmount) {
        if (userId == null) {
            throw new IllegalArgumentException("사용자 ID는 필수입니다");
        }
        if (totalAmount == null || discountAmount == null) {
            throw new IllegalArgumentException("주문 금액은 필수입니다");
        }
        if (discountAmount.isGreaterThan(totalAmount)) {
            throw new IllegalArgumentException("할인 금액은 주문 금액을 초과할 수 없습니다");
        }
    }

    /**
     * 저장 후 발급된 ID를 기반으로 주문 번호를 부여합니다.
     */
    public void assignOrderNumber() {
        if (this.getId() == null) {
            throw new IllegalStateException("주문 ID가 필요합니다");
        }
        this.orderNumber = "ORD-" + String.format("%010d", this.getId());
    }

    public BigDecimal getTotalAmount() {
        return totalAmount.getAmount();
    }

    public BigDecimal getDiscountAmount() {
        return discountAmount.getAmount();
    }

    public BigDecimal getFinalAmount() {
        return finalAmount.getAmount();
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    /**
     * 주문을 취소합니다. 재고 복구는 호출 측 트랜잭션에서 함께 처리해야 합니다.
     *
     * @throws BusinessException 완료/환불/이미 취소된 주문인 경우
     */
    public void cancel() {
        if (status == OrderStatus.COMPLETED || status == OrderStatus.REFUNDED) {
            throw new BusinessException(ResponseCode.ORDER_INVALID_TRANSITION,
                    "완료되었거나 환불된 주문은 취소할 수 없습니다");
        }
        if (status == OrderStatus.CANCELLED) {
            throw new BusinessException(ResponseCode.ORDER_INVALID_TRANSITION, "이미 취소된 주문입니다");
        }
        this.status = OrderStatus.CANCELLED;
        touch();
    }

    /**
     * 취소 이외의 주문 상태 변경. 취소는 재고 복구가 필요하므로 {@link #cancel()}을 사용합니다.
     */
    public void changeStatus(OrderStatus target) {
        if (target == null) {
            throw new IllegalArgumentException("상태는 필수입니다");
        }
        if (target == OrderStatus.CANCELLED) {
            throw new IllegalArgumentException("주문 취소는 cancel()을 사용해야 합니다");
        }
        if (!status.canTransitionTo(target)) {
            throw new BusinessException(ResponseCode.ORDER_INVALID_TRANSITION,
                    "주문 상태를 " + status + "에서 " + target + "(으)로 변경할 수 없습니다");
        }
        this.status = target;
        touch();
    }

    public void changePaymentStatus(PaymentStatus target) {
        if (target == null) {
            throw new IllegalArgumentException("결제 상태는 필수입니다");
        }
        if (!paymentStatus.canTransitionTo(target)) {
            throw new BusinessException(ResponseCode.ORDER_INVALID_TRANSITION,
                    "결제 상태를 " + paymentStatus + "에서 " + target + "(으)로 변경할 수 없습니다");
        }
        this.paymentStatus = target;
        touch();
    }
}
