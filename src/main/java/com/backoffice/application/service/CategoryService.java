package com.backoffice.application.service;

import com.backoffice.application.dto.CategoryCreateRequest;
import com.backoffice.application.dto.CategoryResponse;
import com.backoffice.application.dto.CategoryUpdateRequest;
import com.backoffice.config.CaffeineCacheConfig;
import com.backoffice.domain.entity.Category;
import com.backoffice.domain.repository.CategoryRepository;
import com.backoffice.domain.repository.ProductRepository;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 카테고리 관리 서비스
 *
 * 조회 결과는 로컬 캐시(Caffeine)에 저장되며, 쓰기 작업이 일어나면 캐시 전체를 비웁니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;

    @Transactional
    @CacheEvict(value = CaffeineCacheConfig.CATEGORY_CACHE, allEntries = true)
    public CategoryResponse createCategory(CategoryCreateRequest request) {
        if (categoryRepository.existsBySlug(request.slug())) {
            throw new BusinessException(ResponseCode.CATEGORY_SLUG_DUPLICATED);
        }

        Category category = new Category(request.name(), request.description(), request.slug());
        categoryRepository.save(category);

        log.info("카테고리 생성: categoryId={}, slug={}", category.getId(), category.getSlug());
        return CategoryResponse.from(category);
    }

    @Transactional(readOnly = true)
    @Cacheable(value = CaffeineCacheConfig.CATEGORY_CACHE, key = "'all'")
    public List<CategoryResponse> getCategories() {
        return categoryRepository.findAll().stream()
                .map(CategoryResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    @Cacheable(value = CaffeineCacheConfig.CATEGORY_CACHE, key = "#categoryId", unless = "#result == null")
    public CategoryResponse getCategory(Long categoryId) {
        return categoryRepository.findById(categoryId)
                .map(CategoryResponse::from)
                .orElse(null);
    }

    @Transactional
    @CacheEvict(value = CaffeineCacheConfig.CATEGORY_CACHE, allEntries = true)
    public CategoryResponse updateCategory(Long categoryId, CategoryUpdateRequest request) {
        Category category = categoryRepository.getByIdOrThrow(categoryId);

        if (request.name() != null) {
            category.rename(request.name());
        }
        if (request.description() != null) {
            category.changeDescription(request.description());
        }
        if (request.slug() != null && !request.slug().equals(category.getSlug())) {
            if (categoryRepository.existsBySlug(request.slug())) {
                throw new BusinessException(ResponseCode.CATEGORY_SLUG_DUPLICATED);
            }
            category.changeSlug(request.slug());
        }
        if (request.isActive() != null) {
            category.changeActive(request.isActive());
        }
        categoryRepository.save(category);

        log.info("카테고리 수정: categoryId={}", categoryId);
        return CategoryResponse.from(category);
    }

    /**
     * 카테고리를 비활성화합니다. 상품이 하나라도 연결되어 있으면 거부합니다.
     */
    @Transactional
    @CacheEvict(value = CaffeineCacheConfig.CATEGORY_CACHE, allEntries = true)
    public void deleteCategory(Long categoryId) {
        Category category = categoryRepository.getByIdOrThrow(categoryId);
        if (productRepository.existsByCategoryId(categoryId)) {
            throw new BusinessException(ResponseCode.CATEGORY_HAS_PRODUCTS);
        }
        category.deactivate();
        categoryRepository.save(category);

        log.info("카테고리 비활성화: categoryId={}", categoryId);
    }
}
