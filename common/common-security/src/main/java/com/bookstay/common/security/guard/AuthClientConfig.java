package com.bookstay.common.security.guard;

import feign.Request;
import feign.Retryer;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * {@link AuthServiceClient} 전용 Feign 설정.
 *
 * <p>{@code @Configuration}을 붙이지 않는다. 붙이면 컴포넌트 스캔으로 모든 Feign 클라이언트에
 * 적용되어 버린다. {@code @FeignClient(configuration = ...)}로만 참조한다.</p>
 *
 * <ul>
 *   <li>connectTimeout 3초, readTimeout 5초: 인증 서비스가 응답하지 않아도 요청 스레드가
 *       무한정 잡혀 있지 않는다</li>
 *   <li>Retryer.NEVER_RETRY: 가드는 재시도하지 않는다. 일시적 장애도 곧바로 거부로 처리된다</li>
 * </ul>
 */
public class AuthClientConfig {

    @Bean
    public Request.Options authClientRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,   // connectTimeout
                5, TimeUnit.SECONDS,   // readTimeout
                true                    // followRedirects
        );
    }

    @Bean
    public Retryer authClientRetryer() {
        return Retryer.NEVER_RETRY;
    }
}
