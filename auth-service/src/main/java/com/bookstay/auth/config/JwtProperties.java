package com.bookstay.auth.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * JWT 설정 (application.yml의 {@code jwt.*}).
 *
 * <p>기본값이 없다. JWT_SECRET, JWT_EXPIRATION 환경 변수가 없으면 애플리케이션이 기동하지 않는다.
 * 기동 후에는 바뀌지 않는 불변 값으로, 필요한 컴포넌트에 생성자로 전달된다.</p>
 *
 * @param secret     HMAC-SHA256 서명 키 (최소 32바이트 = 256비트)
 * @param expiration 토큰 수명 (초)
 */
@Validated
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
        @NotBlank @Size(min = 32, message = "jwt.secret must be at least 32 characters")
        String secret,

        @Positive
        long expiration
) {}
