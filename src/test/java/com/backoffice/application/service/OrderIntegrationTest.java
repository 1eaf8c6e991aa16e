package com.backoffice.application.service;

import com.backoffice.application.dto.OrderCreateRequest;
import com.backoffice.application.dto.OrderCreateRequest.OrderItemRequest;
import com.backoffice.application.dto.OrderResponse;
import com.backoffice.config.IntegrationTestSupport;
import com.backoffice.domain.entity.*;
import com.backoffice.domain.repository.*;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * 주문 생성/취소 플로우와 동시 주문 시 재고, 쿠폰 한도 정합성을 검증합니다.
 */
@DisplayName("주문 통합 테스트")
class OrderIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private OrderService orderService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CouponRepository couponRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long userId;
    private Long categoryId;

    @BeforeEach
    void setUp() {
        User user = userRepository.save(new User("buyer@example.com", "$2a$10$encodedPasswordHash", "Jane", "Doe", UserRole.CUSTOMER));
        userId = user.getId();
        Category category = categoryRepository.save(new Category("전자책", null, "ebooks"));
        categoryId = category.getId();
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.update("DELETE FROM order_items");
        jdbcTemplate.update("DELETE FROM orders");
        jdbcTemplate.update("DELETE FROM cart_items");
        jdbcTemplate.update("DELETE FROM coupons");
        jdbcTemplate.update("DELETE FROM products");
        jdbcTemplate.update("DELETE FROM categories");
        jdbcTemplate.update("DELETE FROM users");
    }

    private Product saveProduct(String name, String price, Integer stock) {
        return productRepository.save(
                new Product(name, null, new BigDecimal(price), ProductType.DIGITAL_PRODUCT, categoryId, stock));
    }

    private OrderCreateRequest singleLine(Long productId, int quantity, String price, String couponCode) {
        return new OrderCreateRequest(userId,
                List.of(new OrderItemRequest(productId, quantity, new BigDecimal(price))), couponCode);
    }

    @Test
    @DisplayName("쿠폰을 적용한 주문 생성 시 재고, 쿠폰 사용 횟수, 주문 항목이 함께 저장된다")
    void createOrder_WithCoupon() {
        // given
        Product ebook = saveProduct("Java 전자책", "29.99", 5);
        Product course = saveProduct("온라인 강의", "9.99", null);
        couponRepository.save(new Coupon("SAVE10", DiscountType.PERCENTAGE, BigDecimal.TEN, null, 100, null));

        OrderCreateRequest request = new OrderCreateRequest(userId, List.of(
                new OrderItemRequest(ebook.getId(), 2, new BigDecimal("29.99")),
                new OrderItemRequest(course.getId(), 1, new BigDecimal("9.99"))
        ), "SAVE10");

        // when
        OrderResponse response = orderService.createOrder(request);

        // then
        assertThat(response.orderNumber()).isEqualTo(String.format("ORD-%010d", response.orderId()));
        assertThat(response.totalAmount()).isEqualByComparingTo("69.97");
        assertThat(response.discountAmount()).isEqualByComparingTo("7.00");
        assertThat(response.finalAmount()).isEqualByComparingTo("62.97");

        assertThat(productRepository.getByIdOrThrow(ebook.getId()).getStockQuantity()).isEqualTo(3);
        assertThat(productRepository.getByIdOrThrow(course.getId()).getStockQuantity()).isNull();
        assertThat(couponRepository.findByCode("SAVE10")).get()
                .extracting(Coupon::getUsedCount)
                .isEqualTo(1);
        assertThat(orderItemRepository.findByOrderId(response.orderId())).hasSize(2);
    }

    @Test
    @DisplayName("검증에 실패하면 주문과 재고 변경이 모두 롤백된다")
    void createOrder_RollbackOnFailure() {
        // given
        Product ebook = saveProduct("Java 전자책", "29.99", 5);
        Product other = saveProduct("Kotlin 전자책", "19.99", 5);
        OrderCreateRequest request = new OrderCreateRequest(userId, List.of(
                new OrderItemRequest(ebook.getId(), 1, new BigDecimal("29.99")),
                new OrderItemRequest(other.getId(), 1, new BigDecimal("15.00"))
        ), null);

        // when & then
        assertThatThrownBy(() -> orderService.createOrder(request))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getResponseCode())
                .isEqualTo(ResponseCode.ORDER_PRICE_MISMATCH);

        assertThat(productRepository.getByIdOrThrow(ebook.getId()).getStockQuantity()).isEqualTo(5);
        assertThat(orderRepository.findByUserId(userId)).isEmpty();
    }

    @Test
    @DisplayName("주문을 취소하면 재고가 복구되고 쿠폰 사용 횟수는 유지된다")
    void cancelOrder_RestoresStock() {
        // given
        Product ebook = saveProduct("Java 전자책", "29.99", 5);
        couponRepository.save(new Coupon("FLAT5", DiscountType.FIXED_AMOUNT, new BigDecimal("5"), null, null, null));
        OrderResponse created = orderService.createOrder(singleLine(ebook.getId(), 2, "29.99", "FLAT5"));

        // when
        OrderResponse cancelled = orderService.cancelOrder(created.orderId(), userId);

        // then
        assertThat(cancelled.status()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(productRepository.getByIdOrThrow(ebook.getId()).getStockQuantity()).isEqualTo(5);
        assertThat(couponRepository.findByCode("FLAT5")).get()
                .extracting(Coupon::getUsedCount)
                .isEqualTo(1);

        assertThatThrownBy(() -> orderService.cancelOrder(created.orderId(), userId))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("이미 취소된 주문입니다");
    }

    @Test
    @DisplayName("재고가 1개인 상품을 동시에 주문하면 한 건만 성공한다")
    void createOrder_ConcurrentLastUnit() throws InterruptedException {
        // given
        Product ebook = saveProduct("한정판 전자책", "49.99", 1);
        int threadCount = 5;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        ConcurrentLinkedQueue<ResponseCode> failures = new ConcurrentLinkedQueue<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    startLatch.await();
                    orderService.createOrder(singleLine(ebook.getId(), 1, "49.99", null));
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    failures.add(e.getResponseCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        boolean finished = doneLatch.await(30, TimeUnit.SECONDS);
        executorService.shutdown();

        // then
        assertThat(finished).isTrue();
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(failures).hasSize(threadCount - 1)
                .containsOnly(ResponseCode.PRODUCT_OUT_OF_STOCK);
        assertThat(productRepository.getByIdOrThrow(ebook.getId()).getStockQuantity()).isZero();
    }

    @Test
    @DisplayName("사용 한도가 1인 쿠폰을 동시에 사용하면 한 건만 적용된다")
    void createOrder_ConcurrentCouponLimit() throws InterruptedException {
        // given
        Product ebook = saveProduct("Java 전자책", "29.99", null);
        couponRepository.save(new Coupon("ONCE", DiscountType.FIXED_AMOUNT, new BigDecimal("5"), null, 1, null));
        int threadCount = 3;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        ConcurrentLinkedQueue<ResponseCode> failures = new ConcurrentLinkedQueue<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            executorService.submit(() -> {
                try {
                    startLatch.await();
                    orderService.createOrder(singleLine(ebook.getId(), 1, "29.99", "ONCE"));
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    failures.add(e.getResponseCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        boolean finished = doneLatch.await(30, TimeUnit.SECONDS);
        executorService.shutdown();

        // then
        assertThat(finished).isTrue();
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(failures).containsOnly(ResponseCode.COUPON_EXHAUSTED);
        assertThat(couponRepository.findByCode("ONCE")).get()
                .extracting(Coupon::getUsedCount)
                .isEqualTo(1);
    }
}
