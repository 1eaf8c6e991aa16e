package com.backoffice.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine 로컬 캐시 설정
 *
 * 카테고리는 변경이 드물고 상품 화면마다 조회되므로 로컬 캐시에 둡니다.
 * 쓰기 시 전체 무효화되며, TTL은 다중 인스턴스 환경에서 오래된 값이 남는 시간의 상한입니다.
 */
@Configuration
@EnableCaching
public class CaffeineCacheConfig {

    public static final String CATEGORY_CACHE = "categoryCache";
    public static final int CACHE_TTL_SECONDS = 300;  // 5분
    public static final int CACHE_MAX_SIZE = 500;

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(CATEGORY_CACHE);
        cacheManager.setCaffeine(caffeineCacheBuilder());
        return cacheManager;
    }

    private Caffeine<Object, Object> caffeineCacheBuilder() {
        return Caffeine.newBuilder()
                .expireAfterWrite(CACHE_TTL_SECONDS, TimeUnit.SECONDS)
                .maximumSize(CACHE_MAX_SIZE)
                .recordStats();
    }
}
