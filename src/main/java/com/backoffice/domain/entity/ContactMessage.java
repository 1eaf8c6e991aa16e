package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import com.backoffice.domain.vo.Email;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 방문자 문의 Entity
 * 관리자가 읽음/안읽음 상태로 관리합니다.
 */
@Entity
@Table(name = "contact_messages", indexes = @Index(name = "idx_contact_messages_is_read", columnList = "is_read"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContactMessage extends BaseTimeEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "email", nullable = false, length = 255)
    private Email email;

    @Column(name = "subject", nullable = false, length = 200)
    private String subject;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    public ContactMessage(String name, String email, String subject, String message) {
        requireText(name, "이름은 필수입니다");
        requireText(subject, "제목은 필수입니다");
        requireText(message, "문의 내용은 필수입니다");
        this.name = name;
        this.email = Email.of(email);
        this.subject = subject;
        this.message = message;
        this.read = false;
        initializeTimestamps();
    }

    private static void requireText(String value, String errorMessage) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(errorMessage);
        }
    }

    public String getEmail() {
        return email.getValue();
    }

    public void markAsRead() {
        this.read = true;
        touch();
    }

    public void markAsUnread() {
        this.read = false;
        touch();
    }
}
