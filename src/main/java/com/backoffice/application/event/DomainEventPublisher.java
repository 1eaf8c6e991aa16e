package com.backoffice.application.event;

/**
 * 도메인 이벤트 발행 추상화 인터페이스
 *
 * 서비스 코드는 ApplicationEventPublisher 대신 이 인터페이스에 의존합니다.
 * 단위 테스트에서는 Mock으로 대체합니다.
 */
public interface DomainEventPublisher {

    void publish(Object event);
}
