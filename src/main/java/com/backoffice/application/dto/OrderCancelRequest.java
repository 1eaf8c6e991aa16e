package com.backoffice.application.dto;

/**
 * userId가 있으면 해당 사용자의 주문인 경우에만 취소합니다.
 */
public record OrderCancelRequest(
    Long userId  // optional
) {}
