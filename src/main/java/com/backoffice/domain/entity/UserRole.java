package com.backoffice.domain.entity;

/**
 * 사용자 권한
 */
public enum UserRole {
    ADMIN,       // 관리자
    CUSTOMER     // 일반 고객
}
