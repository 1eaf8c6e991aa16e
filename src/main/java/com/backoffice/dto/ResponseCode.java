package com.backoffice.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * API 응답 코드 정의
 *
 * 코드 구조: {도메인}_{숫자}
 * - COMMON: 1xxx (공통)
 * - PRODUCT / CATEGORY: 2xxx (카탈로그)
 * - ORDER: 3xxx (주문)
 * - COUPON: 4xxx (쿠폰)
 * - USER: 5xxx (사용자)
 * - CART: 6xxx (장바구니)
 * - REVIEW: 7xxx (리뷰)
 * - CONTACT: 8xxx (문의)
 */
@Getter
@RequiredArgsConstructor
public enum ResponseCode {

    // ===== 공통 (1xxx) =====
    SUCCESS(HttpStatus.OK, "COMMON_1000", "요청이 성공적으로 처리되었습니다."),
    CREATED(HttpStatus.CREATED, "COMMON_1001", "리소스가 성공적으로 생성되었습니다."),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "COMMON_1400", "잘못된 요청입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "COMMON_1404", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "COMMON_1409", "동시성 충돌이 발생했습니다. 잠시 후 다시 시도해주세요."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "COMMON_1500", "서버 내부 오류가 발생했습니다."),

    // ===== 카탈로그 (2xxx) =====
    PRODUCT_SUCCESS(HttpStatus.OK, "PRODUCT_2000", "상품 조회에 성공했습니다."),
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "PRODUCT_2001", "상품을 찾을 수 없습니다."),
    PRODUCT_OUT_OF_STOCK(HttpStatus.BAD_REQUEST, "PRODUCT_2002", "상품 재고가 부족합니다."),
    PRODUCT_CREATED(HttpStatus.CREATED, "PRODUCT_2003", "상품이 등록되었습니다."),
    PRODUCT_UPDATED(HttpStatus.OK, "PRODUCT_2004", "상품이 수정되었습니다."),
    PRODUCT_DELETED(HttpStatus.OK, "PRODUCT_2005", "상품이 삭제되었습니다."),
    CATEGORY_SUCCESS(HttpStatus.OK, "CATEGORY_2100", "카테고리 조회에 성공했습니다."),
    CATEGORY_NOT_FOUND(HttpStatus.NOT_FOUND, "CATEGORY_2101", "카테고리를 찾을 수 없습니다."),
    CATEGORY_SLUG_DUPLICATED(HttpStatus.CONFLICT, "CATEGORY_2102", "이미 사용 중인 카테고리 슬러그입니다."),
    CATEGORY_HAS_PRODUCTS(HttpStatus.BAD_REQUEST, "CATEGORY_2103", "상품이 등록된 카테고리는 삭제할 수 없습니다."),
    CATEGORY_CREATED(HttpStatus.CREATED, "CATEGORY_2104", "카테고리가 생성되었습니다."),

    // ===== 주문 (3xxx) =====
    ORDER_SUCCESS(HttpStatus.OK, "ORDER_3000", "주문 조회에 성공했습니다."),
    ORDER_CREATED(HttpStatus.CREATED, "ORDER_3001", "주문이 생성되었습니다."),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "ORDER_3002", "주문을 찾을 수 없습니다."),
    ORDER_INVALID_TRANSITION(HttpStatus.BAD_REQUEST, "ORDER_3003", "허용되지 않는 주문 상태 변경입니다."),
    ORDER_PRICE_MISMATCH(HttpStatus.BAD_REQUEST, "ORDER_3004", "상품 가격이 변경되었습니다. 다시 확인해주세요."),
    ORDER_CANCELLED(HttpStatus.OK, "ORDER_3005", "주문이 취소되었습니다."),
    ORDER_STATUS_UPDATED(HttpStatus.OK, "ORDER_3006", "주문 상태가 변경되었습니다."),

    // ===== 쿠폰 (4xxx) =====
    COUPON_SUCCESS(HttpStatus.OK, "COUPON_4000", "쿠폰 조회에 성공했습니다."),
    COUPON_CREATED(HttpStatus.CREATED, "COUPON_4001", "쿠폰이 생성되었습니다."),
    COUPON_NOT_FOUND(HttpStatus.NOT_FOUND, "COUPON_4002", "쿠폰을 찾을 수 없습니다."),
    COUPON_INVALID(HttpStatus.BAD_REQUEST, "COUPON_4003", "유효하지 않은 쿠폰 코드입니다."),
    COUPON_EXPIRED(HttpStatus.BAD_REQUEST, "COUPON_4004", "만료된 쿠폰입니다."),
    COUPON_EXHAUSTED(HttpStatus.BAD_REQUEST, "COUPON_4005", "쿠폰 사용 한도를 초과했습니다."),
    COUPON_MINIMUM_NOT_MET(HttpStatus.BAD_REQUEST, "COUPON_4006", "쿠폰 최소 주문 금액을 충족하지 않습니다."),
    COUPON_CODE_DUPLICATED(HttpStatus.CONFLICT, "COUPON_4007", "이미 존재하는 쿠폰 코드입니다."),
    COUPON_IN_USE(HttpStatus.BAD_REQUEST, "COUPON_4008", "주문에 사용된 쿠폰은 삭제할 수 없습니다."),
    COUPON_UPDATED(HttpStatus.OK, "COUPON_4009", "쿠폰이 수정되었습니다."),
    COUPON_DELETED(HttpStatus.OK, "COUPON_4010", "쿠폰이 삭제되었습니다."),

    // ===== 사용자 (5xxx) =====
    USER_SUCCESS(HttpStatus.OK, "USER_5000", "사용자 조회에 성공했습니다."),
    USER_CREATED(HttpStatus.CREATED, "USER_5001", "사용자가 등록되었습니다."),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "USER_5002", "사용자를 찾을 수 없습니다."),
    USER_EMAIL_DUPLICATED(HttpStatus.CONFLICT, "USER_5003", "이미 가입된 이메일입니다."),
    USER_DEACTIVATED(HttpStatus.OK, "USER_5004", "사용자가 비활성화되었습니다."),
    USER_LOGGED_IN(HttpStatus.OK, "USER_5005", "로그인에 성공했습니다."),
    USER_INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "USER_5006", "이메일 또는 비밀번호가 올바르지 않습니다."),

    // ===== 장바구니 (6xxx) =====
    CART_SUCCESS(HttpStatus.OK, "CART_6000", "장바구니 조회에 성공했습니다."),
    CART_ITEM_ADDED(HttpStatus.CREATED, "CART_6001", "장바구니에 상품이 담겼습니다."),
    CART_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "CART_6002", "장바구니 항목을 찾을 수 없습니다."),
    CART_ITEM_UPDATED(HttpStatus.OK, "CART_6003", "장바구니 수량이 변경되었습니다."),
    CART_ITEM_REMOVED(HttpStatus.OK, "CART_6004", "장바구니에서 상품이 삭제되었습니다."),
    CART_CLEARED(HttpStatus.OK, "CART_6005", "장바구니를 비웠습니다."),

    // ===== 리뷰 (7xxx) =====
    REVIEW_SUCCESS(HttpStatus.OK, "REVIEW_7000", "리뷰 조회에 성공했습니다."),
    REVIEW_CREATED(HttpStatus.CREATED, "REVIEW_7001", "리뷰가 등록되었습니다. 승인 후 공개됩니다."),
    REVIEW_NOT_FOUND(HttpStatus.NOT_FOUND, "REVIEW_7002", "리뷰를 찾을 수 없습니다."),
    REVIEW_NOT_PURCHASED(HttpStatus.FORBIDDEN, "REVIEW_7003", "구매한 상품에만 리뷰를 작성할 수 있습니다."),
    REVIEW_DUPLICATED(HttpStatus.CONFLICT, "REVIEW_7004", "이미 리뷰를 작성한 상품입니다."),
    REVIEW_APPROVED(HttpStatus.OK, "REVIEW_7005", "리뷰가 승인되었습니다."),
    REVIEW_REJECTED(HttpStatus.OK, "REVIEW_7006", "리뷰가 반려되었습니다."),

    // ===== 문의 (8xxx) =====
    CONTACT_SUCCESS(HttpStatus.OK, "CONTACT_8000", "문의 조회에 성공했습니다."),
    CONTACT_CREATED(HttpStatus.CREATED, "CONTACT_8001", "문의가 접수되었습니다."),
    CONTACT_NOT_FOUND(HttpStatus.NOT_FOUND, "CONTACT_8002", "문의를 찾을 수 없습니다."),
    CONTACT_UPDATED(HttpStatus.OK, "CONTACT_8003", "문의 상태가 변경되었습니다."),
    CONTACT_DELETED(HttpStatus.OK, "CONTACT_8004", "문의가 삭제되었습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
