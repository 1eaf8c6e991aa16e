package com.backoffice.application.dto;

import java.math.BigDecimal;
import java.util.List;

public record CartSummaryResponse(
    Long userId,
    int totalItems,
    BigDecimal totalAmount,
    List<CartLine> items
) {

    public record CartLine(
        Long cartItemId,
        Long productId,
        String name,
        Integer quantity,
        BigDecimal price,
        BigDecimal total
    ) {}
}
