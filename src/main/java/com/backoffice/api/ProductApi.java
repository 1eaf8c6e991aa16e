package com.backoffice.api;

import com.backoffice.application.dto.ProductCreateRequest;
import com.backoffice.application.dto.ProductDetailResponse;
import com.backoffice.application.dto.ProductResponse;
import com.backoffice.application.dto.ProductUpdateRequest;
import com.backoffice.domain.entity.ProductType;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Product", description = "상품 API")
@RequestMapping("/api/products")
public interface ProductApi {

    @Operation(summary = "상품 등록")
    @PostMapping
    ApiResponse<ProductResponse> createProduct(@Valid @RequestBody ProductCreateRequest request);

    @Operation(summary = "상품 목록 조회", description = "카테고리, 유형, 활성 여부로 필터링합니다.")
    @GetMapping
    ApiResponse<List<ProductResponse>> getProducts(
            @Parameter(description = "카테고리 ID") @RequestParam(required = false) Long categoryId,
            @Parameter(description = "상품 유형") @RequestParam(required = false) ProductType type,
            @Parameter(description = "활성 여부") @RequestParam(required = false) Boolean isActive,
            @Parameter(description = "조회 개수 (기본 20, 최대 100)") @RequestParam(required = false) Integer limit,
            @Parameter(description = "건너뛸 개수 (기본 0)") @RequestParam(required = false) Integer offset
    );

    @Operation(summary = "상품 검색", description = "이름 또는 설명에 검색어가 포함된 활성 상품을 조회합니다.")
    @GetMapping("/search")
    ApiResponse<List<ProductResponse>> searchProducts(
            @Parameter(description = "검색어", required = true, example = "ebook") @RequestParam String query,
            @Parameter(description = "조회 개수 (기본 10)") @RequestParam(required = false) Integer limit
    );

    @Operation(summary = "상품 상세 조회", description = "카테고리와 승인된 리뷰를 함께 조회합니다. 상품이 없으면 data가 null입니다.")
    @GetMapping("/{productId}")
    ApiResponse<ProductDetailResponse> getProduct(
            @Parameter(description = "상품 ID", required = true, example = "1")
            @PathVariable Long productId
    );

    @Operation(summary = "상품 수정")
    @PatchMapping("/{productId}")
    ApiResponse<ProductResponse> updateProduct(
            @Parameter(description = "상품 ID", required = true, example = "1")
            @PathVariable Long productId,
            @Valid @RequestBody ProductUpdateRequest request
    );

    @Operation(summary = "상품 삭제", description = "상품을 비활성화합니다.")
    @DeleteMapping("/{productId}")
    ApiResponse<Void> deleteProduct(
            @Parameter(description = "상품 ID", required = true, example = "1")
            @PathVariable Long productId
    );
}
