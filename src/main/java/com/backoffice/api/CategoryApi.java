package com.backoffice.api;

import com.backoffice.application.dto.CategoryCreateRequest;
import com.backoffice.application.dto.CategoryResponse;
import com.backoffice.application.dto.CategoryUpdateRequest;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Category", description = "카테고리 API")
@RequestMapping("/api/categories")
public interface CategoryApi {

    @Operation(summary = "카테고리 생성")
    @PostMapping
    ApiResponse<CategoryResponse> createCategory(@Valid @RequestBody CategoryCreateRequest request);

    @Operation(summary = "카테고리 목록 조회")
    @GetMapping
    ApiResponse<List<CategoryResponse>> getCategories();

    @Operation(summary = "카테고리 조회", description = "카테고리가 없으면 data가 null입니다.")
    @GetMapping("/{categoryId}")
    ApiResponse<CategoryResponse> getCategory(
            @Parameter(description = "카테고리 ID", required = true, example = "1")
            @PathVariable Long categoryId
    );

    @Operation(summary = "카테고리 수정")
    @PatchMapping("/{categoryId}")
    ApiResponse<CategoryResponse> updateCategory(
            @Parameter(description = "카테고리 ID", required = true, example = "1")
            @PathVariable Long categoryId,
            @Valid @RequestBody CategoryUpdateRequest request
    );

    @Operation(summary = "카테고리 삭제", description = "비활성화합니다. 상품이 연결된 카테고리는 삭제할 수 없습니다.")
    @DeleteMapping("/{categoryId}")
    ApiResponse<Void> deleteCategory(
            @Parameter(description = "카테고리 ID", required = true, example = "1")
            @PathVariable Long categoryId
    );
}
