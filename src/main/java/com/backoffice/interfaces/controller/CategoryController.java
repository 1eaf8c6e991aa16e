package com.backoffice.interfaces.controller;

import com.backoffice.api.CategoryApi;
import com.backoffice.application.dto.CategoryCreateRequest;
import com.backoffice.application.dto.CategoryResponse;
import com.backoffice.application.dto.CategoryUpdateRequest;
import com.backoffice.application.service.CategoryService;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class CategoryController implements CategoryApi {

    private final CategoryService categoryService;

    @Override
    public ApiResponse<CategoryResponse> createCategory(CategoryCreateRequest request) {
        return ApiResponse.of(ResponseCode.CATEGORY_CREATED, categoryService.createCategory(request));
    }

    @Override
    public ApiResponse<List<CategoryResponse>> getCategories() {
        return ApiResponse.of(ResponseCode.CATEGORY_SUCCESS, categoryService.getCategories());
    }

    @Override
    public ApiResponse<CategoryResponse> getCategory(Long categoryId) {
        return ApiResponse.of(ResponseCode.CATEGORY_SUCCESS, categoryService.getCategory(categoryId));
    }

    @Override
    public ApiResponse<CategoryResponse> updateCategory(Long categoryId, CategoryUpdateRequest request) {
        return ApiResponse.of(ResponseCode.CATEGORY_SUCCESS, categoryService.updateCategory(categoryId, request));
    }

    @Override
    public ApiResponse<Void> deleteCategory(Long categoryId) {
        categoryService.deleteCategory(categoryId);
        return ApiResponse.of(ResponseCode.CATEGORY_SUCCESS, null);
    }
}
