package com.bookstay.payments.event;

import com.bookstay.common.event.NotifyEmailEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * {@code notify-email} 토픽으로 알림 이벤트를 발행한다.
 *
 * <p>발행은 비동기이고 결과를 기다리지 않는다(fire-and-forget). 발행이 실패해도
 * 이미 승인된 결제에는 영향을 주지 않으며 로그만 남는다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    // key: 이메일 (같은 수신자의 알림은 같은 파티션으로 → 순서 보장)
    public void publishNotifyEmail(NotifyEmailEvent event) {
        log.info("Publishing NotifyEmailEvent: email={}", event.email());
        kafkaTemplate.send(NotifyEmailEvent.TOPIC, event.email(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish NotifyEmailEvent: email={}", event.email(), ex);
                    }
                });
    }
}
