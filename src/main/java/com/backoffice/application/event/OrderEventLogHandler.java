package com.backoffice.application.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 이벤트 감사 로그 핸들러
 *
 * 커밋된 주문 변경만 기록하도록 AFTER_COMMIT 단계에서 비동기로 처리합니다.
 * 롤백된 주문 생성/취소는 기록되지 않습니다.
 */
@Slf4j
@Component
public class OrderEventLogHandler {

    @Async("eventExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handle(OrderCreatedEvent event) {
        log.info("주문 생성 완료: orderId={}, orderNumber={}, userId={}, finalAmount={}, couponId={}, items={}",
                event.orderId(), event.orderNumber(), event.userId(), event.finalAmount(),
                event.couponId(), event.itemCount());
    }

    @Async("eventExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handle(OrderCancelledEvent event) {
        log.info("주문 취소 완료: orderId={}, orderNumber={}, userId={}, restoredItems={}",
                event.orderId(), event.orderNumber(), event.userId(), event.restoredItemCount());
    }
}
