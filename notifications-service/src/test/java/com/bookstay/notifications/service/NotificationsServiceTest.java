package com.bookstay.notifications.service;

import com.bookstay.common.event.NotifyEmailEvent;
import com.bookstay.notifications.config.NotificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationsServiceTest {

    @Mock
    private JavaMailSender mailSender;

    private NotificationsService notificationsService;

    @BeforeEach
    void setUp() {
        notificationsService = new NotificationsService(mailSender,
                new NotificationProperties("noreply@bookstay.dev", "BookStay Notification"));
    }

    @Test
    @DisplayName("설정된 발신자/제목과 이벤트의 수신자/본문으로 메일 발송")
    void notifyEmail_SendsMessage() {
        notificationsService.notifyEmail(new NotifyEmailEvent("a@x.com", "Payment of $5 has completed successfully."));

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        SimpleMailMessage message = captor.getValue();
        assertThat(message.getFrom()).isEqualTo("noreply@bookstay.dev");
        assertThat(message.getTo()).containsExactly("a@x.com");
        assertThat(message.getSubject()).isEqualTo("BookStay Notification");
        assertThat(message.getText()).isEqualTo("Payment of $5 has completed successfully.");
    }

    @Test
    @DisplayName("SMTP 실패는 리스너 컨테이너로 다시 던짐")
    void notifyEmail_FailurePropagates() {
        willThrow(new MailSendException("SMTP down")).given(mailSender).send(any(SimpleMailMessage.class));

        assertThatThrownBy(() -> notificationsService.notifyEmail(new NotifyEmailEvent("a@x.com", "hi")))
                .isInstanceOf(MailSendException.class);
    }
}
