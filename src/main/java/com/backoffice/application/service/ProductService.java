package com.backoffice.application.service;

import com.backoffice.application.dto.ProductCreateRequest;
import com.backoffice.application.dto.ProductDetailResponse;
import com.backoffice.application.dto.ProductResponse;
import com.backoffice.application.dto.ProductUpdateRequest;
import com.backoffice.domain.entity.Category;
import com.backoffice.domain.entity.Product;
import com.backoffice.domain.entity.ProductType;
import com.backoffice.domain.entity.Review;
import com.backoffice.domain.entity.User;
import com.backoffice.domain.repository.CategoryRepository;
import com.backoffice.domain.repository.ProductRepository;
import com.backoffice.domain.repository.ProductSearchCondition;
import com.backoffice.domain.repository.ReviewRepository;
import com.backoffice.domain.repository.UserRepository;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 상품 관리 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;
    public static final int DEFAULT_SEARCH_LIMIT = 10;

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final ReviewRepository reviewRepository;
    private final UserRepository userRepository;

    @Transactional
    public ProductResponse createProduct(ProductCreateRequest request) {
        validateCategoryExists(request.categoryId());

        Product product = new Product(
                request.name(),
                request.description(),
                request.price(),
                request.type(),
                request.categoryId(),
                request.stockQuantity()
        );
        product.changeImageUrl(request.imageUrl());
        product.changeDownloadUrl(request.downloadUrl());
        productRepository.save(product);

        log.info("상품 등록: productId={}, name={}, price={}", product.getId(), product.getName(), product.getPrice());
        return ProductResponse.from(product);
    }

    private void validateCategoryExists(Long categoryId) {
        if (!categoryRepository.existsById(categoryId)) {
            throw new BusinessException(ResponseCode.CATEGORY_NOT_FOUND);
        }
    }

    @Transactional(readOnly = true)
    public List<ProductResponse> getProducts(Long categoryId, ProductType type, Boolean isActive,
                                             Integer limit, Integer offset) {
        int normalizedLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        int normalizedOffset = offset == null ? 0 : Math.max(0, offset);

        ProductSearchCondition condition = new ProductSearchCondition(
                categoryId, type, isActive, normalizedLimit, normalizedOffset);
        return productRepository.search(condition).stream()
                .map(ProductResponse::from)
                .toList();
    }

    /**
     * 상품 상세 조회. 카테고리와 승인된 리뷰를 함께 반환하며, 상품이 없으면 null을 반환합니다.
     */
    @Transactional(readOnly = true)
    public ProductDetailResponse getProduct(Long productId) {
        return productRepository.findById(productId)
                .map(this::toDetailResponse)
                .orElse(null);
    }

    private ProductDetailResponse toDetailResponse(Product product) {
        Category category = categoryRepository.findById(product.getCategoryId()).orElse(null);
        List<Review> reviews = reviewRepository.findByProductId(product.getId(), true);
        Map<Long, User> authors = userRepository.findAllById(
                        reviews.stream().map(Review::getUserId).distinct().toList()).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
        return ProductDetailResponse.of(product, category, reviews, authors);
    }

    @Transactional
    public ProductResponse updateProduct(Long productId, ProductUpdateRequest request) {
        Product product = productRepository.getByIdOrThrow(productId);

        if (request.name() != null) {
            product.rename(request.name());
        }
        if (request.description() != null) {
            product.changeDescription(request.description());
        }
        if (request.price() != null) {
            product.changePrice(request.price());
        }
        if (request.type() != null) {
            product.changeType(request.type());
        }
        if (request.categoryId() != null && !request.categoryId().equals(product.getCategoryId())) {
            validateCategoryExists(request.categoryId());
            product.moveToCategory(request.categoryId());
        }
        if (request.imageUrl() != null) {
            product.changeImageUrl(request.imageUrl());
        }
        if (request.downloadUrl() != null) {
            product.changeDownloadUrl(request.downloadUrl());
        }
        if (request.stockQuantity() != null) {
            product.changeStockQuantity(request.stockQuantity());
        }
        if (request.isActive() != null) {
            product.changeActive(request.isActive());
        }
        productRepository.save(product);

        log.info("상품 수정: productId={}", productId);
        return ProductResponse.from(product);
    }

    /**
     * 상품을 비활성화합니다. 기존 주문 항목은 상품명 스냅샷을 가지고 있으므로 영향이 없습니다.
     */
    @Transactional
    public void deleteProduct(Long productId) {
        Product product = productRepository.getByIdOrThrow(productId);
        product.deactivate();
        productRepository.save(product);

        log.info("상품 비활성화: productId={}", productId);
    }

    @Transactional(readOnly = true)
    public List<ProductResponse> searchProducts(String query, Integer limit) {
        if (!StringUtils.hasText(query)) {
            throw new BusinessException(ResponseCode.BAD_REQUEST, "검색어는 필수입니다");
        }
        int normalizedLimit = limit == null ? DEFAULT_SEARCH_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        return productRepository.searchByKeyword(query.trim(), normalizedLimit).stream()
                .map(ProductResponse::from)
                .toList();
    }
}
