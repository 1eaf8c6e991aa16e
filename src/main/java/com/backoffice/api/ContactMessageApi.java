package com.backoffice.api;

import com.backoffice.application.dto.ContactMessageCreateRequest;
import com.backoffice.application.dto.ContactMessageResponse;
import com.backoffice.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Contact", description = "방문자 문의 API")
@RequestMapping("/api/contact-messages")
public interface ContactMessageApi {

    @Operation(summary = "문의 접수")
    @PostMapping
    ApiResponse<ContactMessageResponse> createContactMessage(@Valid @RequestBody ContactMessageCreateRequest request);

    @Operation(summary = "문의 목록 조회", description = "최신순으로 조회합니다.")
    @GetMapping
    ApiResponse<List<ContactMessageResponse>> getContactMessages(
            @Parameter(description = "읽음 여부") @RequestParam(required = false) Boolean isRead,
            @Parameter(description = "조회 개수 (기본 20, 최대 100)") @RequestParam(required = false) Integer limit,
            @Parameter(description = "건너뛸 개수 (기본 0)") @RequestParam(required = false) Integer offset
    );

    @Operation(summary = "안읽은 문의 개수 조회")
    @GetMapping("/unread-count")
    ApiResponse<Long> getUnreadCount();

    @Operation(summary = "문의 조회", description = "문의가 없으면 data가 null입니다.")
    @GetMapping("/{contactMessageId}")
    ApiResponse<ContactMessageResponse> getContactMessage(
            @Parameter(description = "문의 ID", required = true, example = "1") @PathVariable Long contactMessageId
    );

    @Operation(summary = "문의 읽음 처리")
    @PatchMapping("/{contactMessageId}/read")
    ApiResponse<ContactMessageResponse> markAsRead(
            @Parameter(description = "문의 ID", required = true, example = "1") @PathVariable Long contactMessageId
    );

    @Operation(summary = "문의 안읽음 처리")
    @PatchMapping("/{contactMessageId}/unread")
    ApiResponse<ContactMessageResponse> markAsUnread(
            @Parameter(description = "문의 ID", required = true, example = "1") @PathVariable Long contactMessageId
    );

    @Operation(summary = "문의 삭제")
    @DeleteMapping("/{contactMessageId}")
    ApiResponse<Void> deleteContactMessage(
            @Parameter(description = "문의 ID", required = true, example = "1") @PathVariable Long contactMessageId
    );
}
