package com.backoffice.domain.service;

import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.ProductType;
import com.backoffice.domain.repository.OrderItemRepository;
import com.backoffice.domain.repository.OrderRepository;
import com.backoffice.domain.vo.Money;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderDomainService 테스트")
class OrderDomainServiceTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderItemRepository orderItemRepository;

    @InjectMocks
    private OrderDomainService orderDomainService;

    private Product ebook;
    private Product course;
    private Map<Long, Product> products;

    @BeforeEach
    void setUp() {
        ebook = new Product("Java 전자책", null, new BigDecimal("29.99"), ProductType.DIGITAL_PRODUCT, 1L, 5);
        ebook.setId(1L);
        course = new Product("온라인 강의", null, new BigDecimal("9.99"), ProductType.SERVICE, 1L, null);
        course.setId(2L);
        products = Map.of(1L, ebook, 2L, course);
    }

    private ResponseCode responseCodeOf(Throwable throwable) {
        return ((BusinessException) throwable).getResponseCode();
    }

    @Test
    @DisplayName("라인 금액의 합을 반환한다")
    void validateLines_ReturnsTotal() {
        // given
        List<OrderLine> lines = List.of(
                new OrderLine(1L, 2, new BigDecimal("29.99")),
                new OrderLine(2L, 1, new BigDecimal("9.99"))
        );

        // when
        Money total = orderDomainService.validateLines(lines, products);

        // then
        assertThat(total).isEqualTo(Money.of("69.97"));
    }

    @Test
    @DisplayName("존재하지 않는 상품이 있으면 PRODUCT_NOT_FOUND")
    void validateLines_MissingProduct() {
        // given
        List<OrderLine> lines = List.of(new OrderLine(999L, 1, new BigDecimal("1.00")));

        // when & then
        assertThatThrownBy(() -> orderDomainService.validateLines(lines, products))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("999")
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.PRODUCT_NOT_FOUND));
    }

    @Test
    @DisplayName("비활성 상품은 존재하지 않는 상품과 동일하게 처리한다")
    void validateLines_InactiveProduct() {
        // given
        ebook.deactivate();
        List<OrderLine> lines = List.of(new OrderLine(1L, 1, new BigDecimal("29.99")));

        // when & then
        assertThatThrownBy(() -> orderDomainService.validateLines(lines, products))
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.PRODUCT_NOT_FOUND));
    }

    @Test
    @DisplayName("가격 차이가 0.01을 넘으면 ORDER_PRICE_MISMATCH")
    void validateLines_PriceMismatch() {
        // given
        List<OrderLine> lines = List.of(new OrderLine(1L, 1, new BigDecimal("25.00")));

        // when & then
        assertThatThrownBy(() -> orderDomainService.validateLines(lines, products))
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.ORDER_PRICE_MISMATCH));
    }

    @Test
    @DisplayName("반올림하면 허용 오차 안에 들어오는 가격도 원래 값 기준으로 ORDER_PRICE_MISMATCH")
    void validateLines_UnroundedPriceMismatch() {
        // given
        List<OrderLine> below = List.of(new OrderLine(1L, 1, new BigDecimal("29.975")));
        List<OrderLine> above = List.of(new OrderLine(1L, 1, new BigDecimal("30.005")));

        // when & then
        assertThatThrownBy(() -> orderDomainService.validateLines(below, products))
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.ORDER_PRICE_MISMATCH));
        assertThatThrownBy(() -> orderDomainService.validateLines(above, products))
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.ORDER_PRICE_MISMATCH));
    }

    @Test
    @DisplayName("같은 상품의 수량은 누적해서 재고와 비교한다")
    void validateLines_CumulativeStock() {
        // given
        List<OrderLine> lines = List.of(
                new OrderLine(1L, 3, new BigDecimal("29.99")),
                new OrderLine(1L, 3, new BigDecimal("29.99"))
        );

        // when & then
        assertThatThrownBy(() -> orderDomainService.validateLines(lines, products))
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.PRODUCT_OUT_OF_STOCK));
    }

    @Test
    @DisplayName("입력 순서상 먼저 나오는 위반이 보고된다")
    void validateLines_FirstViolationWins() {
        // given
        List<OrderLine> lines = List.of(
                new OrderLine(1L, 10, new BigDecimal("29.99")),
                new OrderLine(999L, 1, new BigDecimal("1.00"))
        );

        // when & then
        assertThatThrownBy(() -> orderDomainService.validateLines(lines, products))
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.PRODUCT_OUT_OF_STOCK));
    }

    @Test
    @DisplayName("재고를 추적하지 않는 상품은 수량 제한이 없다")
    void validateLines_UntrackedStock() {
        // given
        List<OrderLine> lines = List.of(new OrderLine(2L, 1000, new BigDecimal("9.99")));

        // when
        Money total = orderDomainService.validateLines(lines, products);

        // then
        assertThat(total).isEqualTo(Money.of("9990.00"));
    }

    @Test
    @DisplayName("빈 주문은 BAD_REQUEST")
    void validateLines_Empty() {
        // when & then
        assertThatThrownBy(() -> orderDomainService.validateLines(List.of(), products))
                .satisfies(e -> assertThat(responseCodeOf(e)).isEqualTo(ResponseCode.BAD_REQUEST));
    }
}
