package com.bookstay.reservations.client;

import feign.Request;
import feign.Retryer;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * {@link PaymentsServiceClient} 전용 Feign 설정 ({@code @Configuration} 없음).
 *
 * <p>결제 게이트웨이 왕복이 포함되므로 readTimeout을 인증 클라이언트보다 길게 둔다.
 * 결제는 멱등하지 않으므로 Feign 레벨 재시도는 하지 않는다.</p>
 */
public class PaymentsClientConfig {

    @Bean
    public Request.Options paymentsClientRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,    // connectTimeout
                10, TimeUnit.SECONDS,   // readTimeout
                true
        );
    }

    @Bean
    public Retryer paymentsClientRetryer() {
        return Retryer.NEVER_RETRY;
    }
}
