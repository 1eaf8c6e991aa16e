package com.backoffice.application.dto;

import com.backoffice.domain.entity.ContactMessage;

import java.time.LocalDateTime;

public record ContactMessageResponse(
    Long contactMessageId,
    String name,
    String email,
    String subject,
    String message,
    Boolean isRead,
    LocalDateTime createdAt
) {

    public static ContactMessageResponse from(ContactMessage contactMessage) {
        return new ContactMessageResponse(
            contactMessage.getId(),
            contactMessage.getName(),
            contactMessage.getEmail(),
            contactMessage.getSubject(),
            contactMessage.getMessage(),
            contactMessage.isRead(),
            contactMessage.getCreatedAt()
        );
    }
}
