package com.backoffice.domain.entity;

/**
 * 상품 유형
 * 두 유형 모두 재고 추적은 선택 사항입니다 (stock_quantity가 null이면 무제한).
 */
public enum ProductType {
    DIGITAL_PRODUCT,   // 디지털 상품 (다운로드)
    SERVICE            // 서비스
}
