package com.bookstay.notifications.event;

import com.bookstay.common.event.NotifyEmailEvent;
import com.bookstay.notifications.service.NotificationsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class NotifyEmailEventListenerTest {

    @Mock
    private NotificationsService notificationsService;

    @InjectMocks
    private NotifyEmailEventListener listener;

    @Test
    @DisplayName("수신한 이벤트를 그대로 메일 발송에 전달")
    void handleNotifyEmail_Delegates() {
        NotifyEmailEvent event = new NotifyEmailEvent("a@x.com", "hello");

        listener.handleNotifyEmail(event);

        verify(notificationsService).notifyEmail(event);
    }

    @Test
    @DisplayName("수신자가 없는 이벤트는 버림")
    void handleNotifyEmail_DropsWithoutRecipient() {
        listener.handleNotifyEmail(new NotifyEmailEvent(" ", "hello"));

        verifyNoInteractions(notificationsService);
    }
}
