package com.backoffice.application.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 전달된(null이 아닌) 필드만 변경합니다.
 */
public record CategoryUpdateRequest(
    @Size(min = 1, max = 100, message = "카테고리명은 1~100자여야 합니다")
    String name,

    String description,

    @Pattern(regexp = "^[a-z0-9]+(?:-[a-z0-9]+)*$", message = "슬러그는 소문자, 숫자, 하이픈만 사용할 수 있습니다")
    String slug,

    Boolean isActive
) {}
