package com.backoffice.application.dto;

import com.backoffice.domain.entity.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UserRegisterRequest(
    @NotBlank(message = "이메일은 필수입니다")
    @Email(message = "이메일 형식이 올바르지 않습니다")
    String email,

    @NotBlank(message = "비밀번호는 필수입니다")
    @Size(min = 6, max = 72, message = "비밀번호는 6자 이상 72자 이하여야 합니다")
    String password,

    @NotBlank(message = "이름은 필수입니다")
    @Size(max = 100, message = "이름은 100자 이하여야 합니다")
    String firstName,

    @NotBlank(message = "성은 필수입니다")
    @Size(max = 100, message = "성은 100자 이하여야 합니다")
    String lastName,

    UserRole role  // optional, 기본값 CUSTOMER
) {}
