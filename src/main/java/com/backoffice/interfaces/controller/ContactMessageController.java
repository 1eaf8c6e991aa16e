package com.backoffice.interfaces.controller;

import com.backoffice.api.ContactMessageApi;
import com.backoffice.application.dto.ContactMessageCreateRequest;
import com.backoffice.application.dto.ContactMessageResponse;
import com.backoffice.application.service.ContactMessageService;
import com.backoffice.dto.ApiResponse;
import com.backoffice.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ContactMessageController implements ContactMessageApi {

    private final ContactMessageService contactMessageService;

    @Override
    public ApiResponse<ContactMessageResponse> createContactMessage(ContactMessageCreateRequest request) {
        return ApiResponse.of(ResponseCode.CONTACT_CREATED, contactMessageService.createContactMessage(request));
    }

    @Override
    public ApiResponse<List<ContactMessageResponse>> getContactMessages(Boolean isRead, Integer limit, Integer offset) {
        return ApiResponse.of(ResponseCode.CONTACT_SUCCESS,
                contactMessageService.getContactMessages(isRead, limit, offset));
    }

    @Override
    public ApiResponse<Long> getUnreadCount() {
        return ApiResponse.of(ResponseCode.CONTACT_SUCCESS, contactMessageService.getUnreadCount());
    }

    @Override
    public ApiResponse<ContactMessageResponse> getContactMessage(Long contactMessageId) {
        return ApiResponse.of(ResponseCode.CONTACT_SUCCESS, contactMessageService.getContactMessage(contactMessageId));
    }

    @Override
    public ApiResponse<ContactMessageResponse> markAsRead(Long contactMessageId) {
        return ApiResponse.of(ResponseCode.CONTACT_UPDATED, contactMessageService.markAsRead(contactMessageId));
    }

    @Override
    public ApiResponse<ContactMessageResponse> markAsUnread(Long contactMessageId) {
        return ApiResponse.of(ResponseCode.CONTACT_UPDATED, contactMessageService.markAsUnread(contactMessageId));
    }

    @Override
    public ApiResponse<Void> deleteContactMessage(Long contactMessageId) {
        contactMessageService.deleteContactMessage(contactMessageId);
        return ApiResponse.of(ResponseCode.CONTACT_DELETED, null);
    }
}
