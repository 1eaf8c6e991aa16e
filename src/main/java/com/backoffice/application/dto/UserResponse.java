package com.backoffice.application.dto;

import com.backoffice.domain.entity.User;
import com.backoffice.domain.entity.UserRole;

import java.time.LocalDateTime;

public record UserResponse(
    Long userId,
    String email,
    String firstName,
    String lastName,
    UserRole role,
    Boolean isActive,
    LocalDateTime createdAt
) {

    public static UserResponse from(User user) {
        return new UserResponse(
            user.getId(),
            user.getEmail(),
            user.getFirstName(),
            user.getLastName(),
            user.getRole(),
            user.isActive(),
            user.getCreatedAt()
        );
    }
}
