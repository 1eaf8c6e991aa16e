package com.backoffice.domain.vo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Email Value Object 테스트")
class EmailTest {

    @Test
    @DisplayName("이메일은 소문자로 정규화된다")
    void createEmail_Normalized() {
        // when
        Email email = Email.of("Admin@Example.COM");

        // then
        assertThat(email.getValue()).isEqualTo("admin@example.com");
        assertThat(email).isEqualTo(Email.of("admin@example.com"));
    }

    @Test
    @DisplayName("형식이 잘못된 이메일은 생성할 수 없다")
    void createEmail_InvalidFormat_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> Email.of("not-an-email"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
