package com.bookstay.common.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.Optional;

/**
 * 요청에서 Bearer 자격 증명(JWT)을 추출하는 헬퍼.
 *
 * <p>탐색 순서 (먼저 찾은 비어있지 않은 값이 이긴다):
 * <ol>
 *   <li>쿠키 {@code Authentication} - 로그인 시 인증 서비스가 설정하는 HttpOnly 쿠키</li>
 *   <li>요청 속성 {@code Authentication} - 같은 JVM 안의 앞단 필터가 넣어둔 값</li>
 *   <li>헤더 {@code Authentication}</li>
 * </ol>
 * 외부 클라이언트가 세 위치 중 어느 것에든 의존할 수 있으므로 순서를 바꾸면 안 된다.</p>
 */
public final class BearerTokenResolver {

    /** 쿠키, 요청 속성, 헤더가 공유하는 이름 */
    public static final String AUTHENTICATION = "Authentication";

    private BearerTokenResolver() {
    }

    public static Optional<String> resolve(HttpServletRequest request) {
        return fromCookie(request)
                .or(() -> fromAttribute(request))
                .or(() -> Optional.ofNullable(request.getHeader(AUTHENTICATION)).filter(StringUtils::hasText));
    }

    private static Optional<String> fromCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> AUTHENTICATION.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(StringUtils::hasText)
                .findFirst();
    }

    private static Optional<String> fromAttribute(HttpServletRequest request) {
        return request.getAttribute(AUTHENTICATION) instanceof String token && StringUtils.hasText(token)
                ? Optional.of(token)
                : Optional.empty();
    }
}
