package com.backoffice.interfaces.controller;

import com.backoffice.api.ProductApi;
import com.backoffice.application.dto.ProductCreateRequest;
import com.backoffice.application.dto.ProductDetailResponse;
import com.backoffice.application.dto.ProductResponse;
import com.backoffice.application.dto.ProductUpdateRequest;
import com.backoffice.application.service.ProductService;
import com.backoffice.domain.entity.ProductType;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ProductController implements ProductApi {

    private final ProductService productService;

    @Override
    public ApiResponse<ProductResponse> createProduct(ProductCreateRequest request) {
        return ApiResponse.of(ResponseCode.PRODUCT_CREATED, productService.createProduct(request));
    }

    @Override
    public ApiResponse<List<ProductResponse>> getProducts(Long categoryId, ProductType type, Boolean isActive,
                                                          Integer limit, Integer offset) {
        return ApiResponse.of(ResponseCode.PRODUCT_SUCCESS,
                productService.getProducts(categoryId, type, isActive, limit, offset));
    }

    @Override
    public ApiResponse<List<ProductResponse>> searchProducts(String query, Integer limit) {
        return ApiResponse.of(ResponseCode.PRODUCT_SUCCESS, productService.searchProducts(query, limit));
    }

    @Override
    public ApiResponse<ProductDetailResponse> getProduct(Long productId) {
        return ApiResponse.of(ResponseCode.PRODUCT_SUCCESS, productService.getProduct(productId));
    }

    @Override
    public ApiResponse<ProductResponse> updateProduct(Long productId, ProductUpdateRequest request) {
        return ApiResponse.of(ResponseCode.PRODUCT_UPDATED, productService.updateProduct(productId, request));
    }

    @Override
    public ApiResponse<Void> deleteProduct(Long productId) {
        productService.deleteProduct(productId);
        return ApiResponse.of(ResponseCode.PRODUCT_DELETED, null);
    }
}
