package com.bookstay.auth.security;

import com.bookstay.auth.service.AuthService;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import com.bookstay.common.security.BearerTokenResolver;
import com.bookstay.common.security.CurrentUserArgumentResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 인증 서비스 내부용 가드 - 원격 호출 없이 {@link AuthService#authenticate}를 직접 호출한다.
 * 자격 증명 추출 순서와 요청 속성 키는 다른 서비스의 위임 가드와 같다.
 */
@Component
@RequiredArgsConstructor
public class LocalJwtAuthGuard implements HandlerInterceptor {

    private final AuthService authService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = BearerTokenResolver.resolve(request)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED));
        request.setAttribute(CurrentUserArgumentResolver.USER_ATTRIBUTE, authService.authenticate(token));
        return true;
    }
}
