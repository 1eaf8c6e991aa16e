package com.backoffice.application.dto;

import com.backoffice.domain.entity.Category;

import java.time.LocalDateTime;

public record CategoryResponse(
    Long categoryId,
    String name,
    String description,
    String slug,
    Boolean isActive,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static CategoryResponse from(Category category) {
        return new CategoryResponse(
            category.getId(),
            category.getName(),
            category.getDescription(),
            category.getSlug(),
            category.isActive(),
            category.getCreatedAt(),
            category.getUpdatedAt()
        );
    }
}
