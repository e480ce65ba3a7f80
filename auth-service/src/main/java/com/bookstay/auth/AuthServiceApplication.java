package com.bookstay.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 인증 서비스(Auth Service)의 진입점.
 *
 * <p>사용자 등록, 자격 증명 검증, JWT 발급/검증을 담당하는 유일한 서비스다.
 * 다른 서비스는 서명 키를 갖지 않고 {@code POST /rpc/authenticate}로 검증을 위임한다.</p>
 *
 * <p>scanBasePackages에 common-exception 패키지를 포함시켜 GlobalExceptionHandler를 등록한다.
 * common-security의 원격 가드(guard 패키지)는 스캔하지 않는다. 인증 서비스가 자기 자신을
 * 호출할 이유가 없으므로 {@link com.bookstay.auth.security.LocalJwtAuthGuard}를 대신 쓴다.</p>
 */
@SpringBootApplication(scanBasePackages = {"com.bookstay.auth", "com.bookstay.common.exception"})
public class AuthServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
