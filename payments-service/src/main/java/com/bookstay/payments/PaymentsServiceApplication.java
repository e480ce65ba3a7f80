package com.bookstay.payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 결제 서비스 진입점. 외부에 노출되지 않는 {@code create-charge} RPC만 제공한다.
 */
@SpringBootApplication(scanBasePackages = {"com.bookstay.payments", "com.bookstay.common.exception"})
public class PaymentsServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(PaymentsServiceApplication.class, args);
    }
}
