package com.backoffice.domain.repository;

import com.backoffice.domain.entity.ContactMessage;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface ContactMessageRepository {

    ContactMessage save(ContactMessage contactMessage);

    Optional<ContactMessage> findById(Long id);

    default ContactMessage getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.CONTACT_NOT_FOUND));
    }

    /**
     * 최신순 목록. read가 null이면 읽음 여부와 관계없이 조회합니다.
     */
    List<ContactMessage> search(Boolean read, int limit, int offset);

    long countUnread();

    void delete(ContactMessage contactMessage);
}
