package com.backoffice.domain.entity;

import com.backoffice.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카테고리 Entity
 * 삭제는 is_active 플래그를 내리는 소프트 삭제로 처리합니다.
 */
@Entity
@Table(name = "categories")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Category extends BaseTimeEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "slug", nullable = false, unique = true, length = 100)
    private String slug;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    public Category(String name, String description, String slug) {
        validateName(name);
        validateSlug(slug);
        this.name = name;
        this.description = description;
        this.slug = slug;
        this.active = true;
        initializeTimestamps();
    }

    private void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("카테고리명은 필수입니다");
        }
    }

    private void validateSlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("슬러그는 필수입니다");
        }
    }

    public void rename(String name) {
        validateName(name);
        this.name = name;
        touch();
    }

    public void changeDescription(String description) {
        this.description = description;
        touch();
    }

    public void changeSlug(String slug) {
        validateSlug(slug);
        this.slug = slug;
        touch();
    }

    public void changeActive(boolean active) {
        this.active = active;
        touch();
    }

    public void deactivate() {
        changeActive(false);
    }
}
