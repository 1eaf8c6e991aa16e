package com.backoffice.domain.service;

import com.backoffice.domain.vo.Money;

import java.math.BigDecimal;

/**
 * 주문 요청의 한 줄. price는 클라이언트가 알고 있는 단가이며 반올림하지 않은 값 그대로 보관합니다.
 */
public record OrderLine(Long productId, int quantity, BigDecimal price) {

    public OrderLine {
        if (productId == null) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1개 이상이어야 합니다");
        }
        if (price == null) {
            throw new IllegalArgumentException("가격은 필수입니다");
        }
    }

    public Money unitPrice() {
        return Money.of(price);
    }

    public Money lineTotal() {
        return unitPrice().multiply(quantity);
    }
}
