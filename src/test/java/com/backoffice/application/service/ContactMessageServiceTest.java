package com.backoffice.application.service;

import com.backoffice.application.dto.ContactMessageCreateRequest;
import com.backoffice.application.dto.ContactMessageResponse;
import com.backoffice.domain.entity.ContactMessage;
import com.backoffice.domain.repository.ContactMessageRepository;
import com.backoffice.dto.ResponseCode;
import com.backoffice.exception.BusinessException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ContactMessageService 테스트")
class ContactMessageServiceTest {

    @Mock
    private ContactMessageRepository contactMessageRepository;

    @InjectMocks
    private ContactMessageService contactMessageService;

    private ContactMessage message() {
        ContactMessage contactMessage = new ContactMessage("John Doe", "John@Example.com", "배송 문의", "언제 받을 수 있나요?");
        contactMessage.setId(1L);
        return contactMessage;
    }

    @Test
    @DisplayName("문의는 안읽음 상태로 접수되고 이메일은 소문자로 정규화된다")
    void createContactMessage() {
        // given
        ContactMessageCreateRequest request =
                new ContactMessageCreateRequest("John Doe", "John@Example.com", "배송 문의", "언제 받을 수 있나요?");

        // when
        ContactMessageResponse response = contactMessageService.createContactMessage(request);

        // then
        assertThat(response.isRead()).isFalse();
        assertThat(response.email()).isEqualTo("john@example.com");
        verify(contactMessageRepository).save(any(ContactMessage.class));
    }

    @Test
    @DisplayName("이메일 형식이 올바르지 않으면 저장하지 않는다")
    void createContactMessage_InvalidEmail() {
        // given
        ContactMessageCreateRequest request =
                new ContactMessageCreateRequest("John Doe", "not-an-email", "배송 문의", "내용");

        // when & then
        assertThatThrownBy(() -> contactMessageService.createContactMessage(request))
                .isInstanceOf(IllegalArgumentException.class);
        verify(contactMessageRepository, never()).save(any());
    }

    @Test
    @DisplayName("목록 조회 limit은 최대 100으로 제한되고 읽음 필터를 전달한다")
    void getContactMessages_LimitCapped() {
        // given
        when(contactMessageRepository.search(false, 100, 0)).thenReturn(List.of(message()));

        // when
        List<ContactMessageResponse> messages = contactMessageService.getContactMessages(false, 500, -3);

        // then
        assertThat(messages).hasSize(1);
    }

    @Test
    @DisplayName("존재하지 않는 문의를 조회하면 null을 반환한다")
    void getContactMessage_NotFoundReturnsNull() {
        // given
        when(contactMessageRepository.findById(99L)).thenReturn(Optional.empty());

        // when & then
        assertThat(contactMessageService.getContactMessage(99L)).isNull();
    }

    @Test
    @DisplayName("읽음 처리 후 안읽음으로 되돌릴 수 있다")
    void markAsReadAndUnread() {
        // given
        ContactMessage contactMessage = message();
        when(contactMessageRepository.getByIdOrThrow(1L)).thenReturn(contactMessage);

        // when & then
        assertThat(contactMessageService.markAsRead(1L).isRead()).isTrue();
        assertThat(contactMessageService.markAsUnread(1L).isRead()).isFalse();
        verify(contactMessageRepository, times(2)).save(contactMessage);
    }

    @Test
    @DisplayName("존재하지 않는 문의를 삭제하면 CONTACT_NOT_FOUND")
    void deleteContactMessage_NotFound() {
        // given
        when(contactMessageRepository.getByIdOrThrow(99L))
                .thenThrow(new BusinessException(ResponseCode.CONTACT_NOT_FOUND));

        // when & then
        assertThatThrownBy(() -> contactMessageService.deleteContactMessage(99L))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getResponseCode())
                .isEqualTo(ResponseCode.CONTACT_NOT_FOUND);
        verify(contactMessageRepository, never()).delete(any());
    }
}
