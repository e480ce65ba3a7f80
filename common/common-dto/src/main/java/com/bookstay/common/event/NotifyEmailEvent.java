package com.bookstay.common.event;

/**
 * 이메일 알림 이벤트 - payments-service가 발행하고 notifications-service가 소비한다.
 *
 * <p>Kafka 토픽 {@value #TOPIC}으로 전달되며, key는 수신자 이메일이다.</p>
 */
public record NotifyEmailEvent(
    String email,  // 수신자
    String text    // 본문
) {
    public static final String TOPIC = "notify-email";
}
