package com.backoffice.domain.service;

import com.backoffice.domain.entity.OrderItem;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.repository.ProductRepository;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 상품 도메인 서비스
 *
 * 책임:
 * - 주문 대상 상품의 행 락 획득
 * - 재고 차감/복구
 *
 * 주의:
 * - 트랜잭션 경계는 상위 Application Service가 관리
 */
@Service
@RequiredArgsConstructor
public class ProductDomainService {

    private final ProductRepository productRepository;

    /**
     * 상품들을 ID 오름차순으로 락을 걸어 조회합니다.
     * 존재하지 않는 ID는 결과 Map에 포함되지 않습니다.
     */
    public Map<Long, Product> lockProducts(Collection<Long> productIds) {
        List<Product> products = productRepository.findAllByIdInWithLock(new TreeSet<>(productIds));
        return products.stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
    }

    /**
     * 재고 차감
     *
     * @param product  락을 획득한 상품
     * @param quantity 차감 수량
     */
    public void reduceStock(Product product, int quantity) {
        try {
            product.reduceStock(quantity);
        } catch (IllegalStateException e) {
            throw new BusinessException(ResponseCode.PRODUCT_OUT_OF_STOCK, e.getMessage());
        }
        productRepository.save(product);
    }

    /**
     * 주문 항목 수량만큼 재고를 복구합니다. 삭제되었거나 재고를 추적하지 않는 상품은 건너뜁니다.
     *
     * @return 재고가 복구된 주문 항목 수
     */
    public int restoreStock(List<OrderItem> orderItems) {
        if (orderItems.isEmpty()) {
            return 0;
        }
        Map<Long, Product> products = lockProducts(
                orderItems.stream().map(OrderItem::getProductId).toList());

        int restored = 0;
        for (OrderItem item : orderItems) {
            Product product = products.get(item.getProductId());
            if (product == null || !product.isStockTracked()) {
                continue;
            }
            product.restoreStock(item.getQuantity());
            productRepository.save(product);
            restored++;
        }
        return restored;
    }
}
