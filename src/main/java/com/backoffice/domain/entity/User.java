package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import com.backoffice.domain.vo.Email;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 사용자 도메인 Entity
 * 주문 생성 시 존재 여부와 활성 상태만 확인합니다.
 * 비밀번호는 BCrypt 해시로만 보관합니다.
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User extends BaseTimeEntity {

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private Email email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    public User(String email, String passwordHash, String firstName, String lastName, UserRole role) {
        validateConstructorParams(passwordHash, firstName, lastName);
        this.email = Email.of(email);
        this.passwordHash = passwordHash;
        this.firstName = firstName;
        this.lastName = lastName;
        this.role = role != null ? role : UserRole.CUSTOMER;
        this.active = true;
        initializeTimestamps();
    }

    private void validateConstructorParams(String passwordHash, String firstName, String lastName) {
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("비밀번호 해시는 필수입니다");
        }
        if (firstName == null || firstName.isBlank()) {
            throw new IllegalArgumentException("이름은 필수입니다");
        }
        if (lastName == null || lastName.isBlank()) {
            throw new IllegalArgumentException("성은 필수입니다");
        }
    }

    public String getEmail() {
        return email.getValue();
    }

    public void deactivate() {
        this.active = false;
        touch();
    }
}
