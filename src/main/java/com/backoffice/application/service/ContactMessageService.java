package com.backoffice.application.service;

import com.backoffice.application.dto.ContactMessageCreateRequest;
import com.backoffice.application.dto.ContactMessageResponse;
import com.backoffice.domain.entity.ContactMessage;
import com.backoffice.domain.repository.ContactMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 방문자 문의 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactMessageService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final ContactMessageRepository contactMessageRepository;

    @Transactional
    public ContactMessageResponse createContactMessage(ContactMessageCreateRequest request) {
        ContactMessage contactMessage = new ContactMessage(
                request.name(), request.email(), request.subject(), request.message());
        contactMessageRepository.save(contactMessage);

        log.info("문의 접수: contactMessageId={}, subject={}", contactMessage.getId(), contactMessage.getSubject());
        return ContactMessageResponse.from(contactMessage);
    }

    @Transactional(readOnly = true)
    public List<ContactMessageResponse> getContactMessages(Boolean isRead, Integer limit, Integer offset) {
        int normalizedLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        int normalizedOffset = offset == null ? 0 : Math.max(0, offset);

        return contactMessageRepository.search(isRead, normalizedLimit, normalizedOffset).stream()
                .map(ContactMessageResponse::from)
                .toList();
    }

    /**
     * 문의 단건 조회. 문의가 없으면 null을 반환합니다.
     */
    @Transactional(readOnly = true)
    public ContactMessageResponse getContactMessage(Long contactMessageId) {
        return contactMessageRepository.findById(contactMessageId)
                .map(ContactMessageResponse::from)
                .orElse(null);
    }

    @Transactional
    public ContactMessageResponse markAsRead(Long contactMessageId) {
        ContactMessage contactMessage = contactMessageRepository.getByIdOrThrow(contactMessageId);
        contactMessage.markAsRead();
        contactMessageRepository.save(contactMessage);
        return ContactMessageResponse.from(contactMessage);
    }

    @Transactional
    public ContactMessageResponse markAsUnread(Long contactMessageId) {
        ContactMessage contactMessage = contactMessageRepository.getByIdOrThrow(contactMessageId);
        contactMessage.markAsUnread();
        contactMessageRepository.save(contactMessage);
        return ContactMessageResponse.from(contactMessage);
    }

    @Transactional
    public void deleteContactMessage(Long contactMessageId) {
        ContactMessage contactMessage = contactMessageRepository.getByIdOrThrow(contactMessageId);
        contactMessageRepository.delete(contactMessage);

        log.info("문의 삭제: contactMessageId={}", contactMessageId);
    }

    @Transactional(readOnly = true)
    public long getUnreadCount() {
        return contactMessageRepository.countUnread();
    }
}
