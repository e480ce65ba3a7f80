package com.bookstay.notifications.event;

import com.bookstay.common.event.NotifyEmailEvent;
import com.bookstay.notifications.service.NotificationsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * {@code notify-email} 토픽 소비자.
 *
 * groupId = "notifications-service": 인스턴스가 여러 개여도 메시지 하나는 그중 하나만 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotifyEmailEventListener {

    private final NotificationsService notificationsService;

    @KafkaListener(topics = NotifyEmailEvent.TOPIC, groupId = "notifications-service")
    public void handleNotifyEmail(NotifyEmailEvent event) {
        log.info("Received NotifyEmailEvent: email={}", event.email());
        if (event.email() == null || event.email().isBlank()) {
            // 수신자가 없는 이벤트는 재시도해도 성공할 수 없다
            log.warn("Dropping NotifyEmailEvent without recipient");
            return;
        }
        notificationsService.notifyEmail(event);
    }
}
