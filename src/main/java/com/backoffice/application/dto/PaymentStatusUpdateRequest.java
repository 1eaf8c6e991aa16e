package com.backoffice.application.dto;

import com.backoffice.domain.entity.PaymentStatus;
import jakarta.validation.constraints.NotNull;

public record PaymentStatusUpdateRequest(
    @NotNull(message = "결제 상태는 필수입니다")
    PaymentStatus paymentStatus
) {}
