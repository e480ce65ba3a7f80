package com.bookstay.reservations;

import com.bookstay.common.security.guard.AuthServiceClient;
import com.bookstay.reservations.client.PaymentsServiceClient;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * 예약 서비스 진입점.
 *
 * <p>common-security의 위임 가드({@code JwtAuthGuard})와 common-exception의
 * GlobalExceptionHandler를 스캔 대상에 포함시킨다. Feign 클라이언트는 인증 서비스와
 * 결제 서비스 두 개다.</p>
 */
@SpringBootApplication(scanBasePackages = {
        "com.bookstay.reservations",
        "com.bookstay.common.exception",
        "com.bookstay.common.security"
})
@EnableFeignClients(basePackageClasses = {AuthServiceClient.class, PaymentsServiceClient.class})
public class ReservationsServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationsServiceApplication.class, args);
    }
}
