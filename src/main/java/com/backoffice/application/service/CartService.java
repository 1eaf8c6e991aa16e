package com.backoffice.application.service;

import com.backoffice.application.dto.CartItemAddRequest;
import com.backoffice.application.dto.CartItemResponse;
import com.backoffice.application.dto.CartItemUpdateRequest;
import com.backoffice.application.dto.CartSummaryResponse;
import com.backoffice.domain.entity.CartItem;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.repository.CartItemRepository;
import com.backoffice.domain.repository.ProductRepository;
import com.backoffice.domain.repository.UserRepository;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 장바구니 서비스
 *
 * 사용자별로 상품당 한 줄을 유지합니다. 이미 담긴 상품을 다시 담으면 수량을 합칩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartService {

    private final CartItemRepository cartItemRepository;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;

    @Transactional
    public CartItemResponse addItem(Long userId, CartItemAddRequest request) {
        userRepository.getActiveByIdOrThrow(userId);
        Product product = productRepository.findById(request.productId())
                .filter(Product::isActive)
                .orElseThrow(() -> new BusinessException(ResponseCode.PRODUCT_NOT_FOUND));

        CartItem cartItem = cartItemRepository.findByUserIdAndProductId(userId, product.getId())
                .map(existing -> {
                    existing.addQuantity(request.quantity());
                    return existing;
                })
                .orElseGet(() -> new CartItem(userId, product.getId(), request.quantity()));
        cartItemRepository.save(cartItem);

        log.info("장바구니 담기: userId={}, productId={}, quantity={}", userId, product.getId(), cartItem.getQuantity());
        return CartItemResponse.of(cartItem, product);
    }

    @Transactional(readOnly = true)
    public List<CartItemResponse> getItems(Long userId) {
        List<CartItem> cartItems = cartItemRepository.findByUserId(userId);
        Map<Long, Product> products = findProducts(cartItems);

        return cartItems.stream()
                .filter(item -> products.containsKey(item.getProductId()))
                .map(item -> CartItemResponse.of(item, products.get(item.getProductId())))
                .toList();
    }

    @Transactional
    public CartItemResponse updateQuantity(Long userId, Long cartItemId, CartItemUpdateRequest request) {
        CartItem cartItem = cartItemRepository.getOwnedOrThrow(cartItemId, userId);
        cartItem.changeQuantity(request.quantity());
        cartItemRepository.save(cartItem);

        Product product = productRepository.getByIdOrThrow(cartItem.getProductId());
        return CartItemResponse.of(cartItem, product);
    }

    @Transactional
    public void removeItem(Long userId, Long cartItemId) {
        CartItem cartItem = cartItemRepository.getOwnedOrThrow(cartItemId, userId);
        cartItemRepository.delete(cartItem);

        log.info("장바구니 삭제: userId={}, cartItemId={}", userId, cartItemId);
    }

    @Transactional
    public void clear(Long userId) {
        cartItemRepository.deleteByUserId(userId);

        log.info("장바구니 비우기: userId={}", userId);
    }

    /**
     * 장바구니 합계. 금액은 현재 상품 가격 기준으로 계산합니다.
     */
    @Transactional(readOnly = true)
    public CartSummaryResponse getSummary(Long userId) {
        List<CartItem> cartItems = cartItemRepository.findByUserId(userId);
        Map<Long, Product> products = findProducts(cartItems);

        List<CartSummaryResponse.CartLine> lines = cartItems.stream()
                .filter(item -> products.containsKey(item.getProductId()))
                .map(item -> {
                    Product product = products.get(item.getProductId());
                    Money lineTotal = Money.of(product.getPrice()).multiply(item.getQuantity());
                    return new CartSummaryResponse.CartLine(
                            item.getId(),
                            product.getId(),
                            product.getName(),
                            item.getQuantity(),
                            product.getPrice(),
                            lineTotal.getAmount()
                    );
                })
                .toList();

        int totalItems = lines.stream()
                .mapToInt(CartSummaryResponse.CartLine::quantity)
                .sum();
        Money totalAmount = lines.stream()
                .map(line -> Money.of(line.total()))
                .reduce(Money.zero(), Money::add);

        return new CartSummaryResponse(userId, totalItems, totalAmount.getAmount(), lines);
    }

    private Map<Long, Product> findProducts(List<CartItem> cartItems) {
        List<Long> productIds = cartItems.stream()
                .map(CartItem::getProductId)
                .distinct()
                .toList();
        return productRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
    }
}
