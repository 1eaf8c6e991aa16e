package com.backoffice.exception;

import com.backoffice.dto.ResponseCode;
import lombok.Getter;

/**
 * 비즈니스 로직 예외
 *
 * 사용 예시:
 * - throw new BusinessException(ResponseCode.PRODUCT_NOT_FOUND);
 * - throw new BusinessException(ResponseCode.ORDER_INVALID_TRANSITION, "이미 취소된 주문입니다");
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ResponseCode responseCode;
    private final String customMessage;

    public BusinessException(ResponseCode responseCode) {
        super(responseCode.getMessage());
        this.responseCode = responseCode;
        this.customMessage = null;
    }

    public BusinessException(ResponseCode responseCode, String customMessage) {
        super(customMessage);
        this.responseCode = responseCode;
        this.customMessage = customMessage;
    }

    public String getErrorMessage() {
        return customMessage != null ? customMessage : responseCode.getMessage();
    }
}
