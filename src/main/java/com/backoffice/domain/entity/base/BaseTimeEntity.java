package com.backoffice.domain.entity.base;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 생성/수정 시간을 관리하는 Entity 기본 클래스
 * 상태가 바뀌는 Entity(주문, 상품, 쿠폰 등)에서 사용합니다.
 */
@MappedSuperclass
@Getter
public abstract class BaseTimeEntity extends BaseEntity {

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 영속화 이전(단위 테스트 등)에도 시간 값을 가지도록 초기화합니다.
     */
    protected void initializeTimestamps() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * 상태 변경 시 수정 시간을 갱신합니다.
     */
    protected void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
