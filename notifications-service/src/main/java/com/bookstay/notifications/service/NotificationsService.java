package com.bookstay.notifications.service;

import com.bookstay.common.event.NotifyEmailEvent;
import com.bookstay.notifications.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * SMTP로 알림 메일을 보낸다.
 *
 * <p>발송 실패는 ERROR 로그 후 다시 던진다. 리스너 컨테이너의 에러 핸들러가
 * 재시도 여부를 결정한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationsService {

    private final JavaMailSender mailSender;
    private final NotificationProperties properties;

    public void notifyEmail(NotifyEmailEvent event) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.from());
        message.setTo(event.email());
        message.setSubject(properties.subject());
        message.setText(event.text());

        try {
            mailSender.send(message);
            log.info("Notification sent: to={}", event.email());
        } catch (MailException e) {
            log.error("Failed to send notification: to={}", event.email(), e);
            throw e;
        }
    }
}
