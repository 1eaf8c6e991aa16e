package com.backoffice.infrastructure.persistence.converter;

import com.backoffice.domain.vo.Email;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 이메일 VO를 소문자로 정규화된 문자열 컬럼으로 저장합니다.
 */
@Converter(autoApply = true)
public class EmailConverter implements AttributeConverter<Email, String> {

    @Override
    public String convertToDatabaseColumn(Email email) {
        return email == null ? null : email.getValue();
    }

    @Override
    public Email convertToEntityAttribute(String value) {
        return value == null ? null : Email.of(value);
    }
}
