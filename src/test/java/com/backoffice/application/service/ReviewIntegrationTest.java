package com.backoffice.application.service;

import com.backoffice.application.dto.OrderCreateRequest;
import com.backoffice.application.dto.OrderCreateRequest.OrderItemRequest;
import com.backoffice.application.dto.OrderResponse;
import com.backoffice.application.dto.ProductDetailResponse;
import com.backoffice.application.dto.ReviewCreateRequest;
import com.backoffice.application.dto.ReviewResponse;
import com.backoffice.config.IntegrationTestSupport;
import com.backoffice.domain.entity.*;
import com.backoffice.domain.repository.CategoryRepository;
import com.backoffice.domain.repository.ProductRepository;
import com.backoffice.domain.repository.UserRepository;
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

import static org.assertj.core.api.Assertions.*;

/**
 * 구매 이력 조회 쿼리와 리뷰 승인 흐름을 실제 DB로 검증합니다.
 */
@DisplayName("리뷰 통합 테스트")
class ReviewIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private ReviewService reviewService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private ProductService productService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long userId;
    private Product ebook;

    @BeforeEach
    void setUp() {
        User user = userRepository.save(
                new User("reviewer@example.com", "$2a$10$encodedPasswordHash", "Test", "User", UserRole.CUSTOMER));
        userId = user.getId();
        Category category = categoryRepository.save(new Category("전자책", null, "ebooks"));
        ebook = productRepository.save(new Product("Java 전자책", null, new BigDecimal("29.99"),
                ProductType.DIGITAL_PRODUCT, category.getId(), 10));
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.update("DELETE FROM reviews");
        jdbcTemplate.update("DELETE FROM order_items");
        jdbcTemplate.update("DELETE FROM orders");
        jdbcTemplate.update("DELETE FROM products");
        jdbcTemplate.update("DELETE FROM categories");
        jdbcTemplate.update("DELETE FROM users");
    }

    private OrderResponse purchase() {
        return orderService.createOrder(new OrderCreateRequest(userId,
                List.of(new OrderItemRequest(ebook.getId(), 1, new BigDecimal("29.99"))), null));
    }

    @Test
    @DisplayName("구매한 상품의 리뷰는 승인 후에만 상품 상세에 노출된다")
    void createReview_VisibleAfterApproval() {
        // given
        purchase();

        // when
        ReviewResponse created = reviewService.createReview(
                new ReviewCreateRequest(userId, ebook.getId(), 5, "Great product!"));

        // then
        assertThat(created.isApproved()).isFalse();
        assertThat(reviewService.getPendingReviews()).hasSize(1);
        assertThat(productService.getProduct(ebook.getId()).reviews()).isEmpty();

        // when
        reviewService.approveReview(created.reviewId());

        // then
        ProductDetailResponse detail = productService.getProduct(ebook.getId());
        assertThat(detail.reviews()).singleElement()
                .satisfies(review -> assertThat(review.userName()).isEqualTo("Test User"));
        assertThat(reviewService.getPendingReviews()).isEmpty();

        assertThatThrownBy(() -> reviewService.createReview(
                new ReviewCreateRequest(userId, ebook.getId(), 1, "다시 작성")))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getResponseCode())
                .isEqualTo(ResponseCode.REVIEW_DUPLICATED);
    }

    @Test
    @DisplayName("취소한 주문은 구매 이력으로 인정되지 않는다")
    void createReview_CancelledOrderNotCounted() {
        // given
        OrderResponse order = purchase();
        orderService.cancelOrder(order.orderId(), userId);

        // when & then
        assertThatThrownBy(() -> reviewService.createReview(
                new ReviewCreateRequest(userId, ebook.getId(), 4, null)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getResponseCode())
                .isEqualTo(ResponseCode.REVIEW_NOT_PURCHASED);
    }
}
