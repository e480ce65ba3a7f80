package com.bookstay.common.security.guard;

import com.bookstay.common.dto.AuthenticateRequest;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import com.bookstay.common.security.BearerTokenResolver;
import com.bookstay.common.security.CurrentUserArgumentResolver;
import feign.FeignException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Optional;

/**
 * 위임 인증 가드 (Delegated Authentication Guard).
 *
 * <p>이 서비스는 JWT 서명 키를 갖지 않는다. 요청의 자격 증명을 인증 서비스에 그대로 넘기고,
 * 인증 서비스가 돌려준 사용자 정보를 요청에 붙일지 말지만 결정한다.</p>
 *
 * <h3>요청별 상태 전이</h3>
 * <pre>
 *   Extract ──(자격 증명 없음)──────────────────────────→ Rejected
 *      │
 *      ▼
 *   Delegate: POST /rpc/authenticate {token}
 *      │
 *      ▼
 *   Await (요청 스레드만 대기, 최대 connect 3s + read 5s)
 *      │
 *      ├─ 200 UserDto ─→ request.setAttribute("user", dto) ─→ Admitted
 *      └─ 401 / 연결 실패 / 타임아웃 ────────────────────→ Rejected
 * </pre>
 *
 * <p>거부 시 {@link ErrorCode#UNAUTHORIZED}를 던지고, {@code GlobalExceptionHandler}가
 * 401 ProblemDetail로 변환한다. 클라이언트에게는 거부 사유를 구분해서 알리지 않는다.
 * 인증 서비스 장애는 재시도 없이 거부로 처리하되 WARN 로그로 남긴다.</p>
 *
 * <p>서블릿 요청당 스레드 모델이므로 한 요청의 원격 호출 대기가 다른 요청을 막지 않는다.
 * 가드 자체는 상태가 없다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthGuard implements HandlerInterceptor {

    private final AuthServiceClient authServiceClient;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Optional<String> token = BearerTokenResolver.resolve(request);
        if (token.isEmpty()) {
            // 자격 증명이 없으면 인증 서비스를 호출하지 않고 바로 거부
            log.debug("No credential on {} {}", request.getMethod(), request.getRequestURI());
            throw rejected();
        }

        UserDto user = authenticate(token.get(), request);
        request.setAttribute(CurrentUserArgumentResolver.USER_ATTRIBUTE, user);
        return true;
    }

    private UserDto authenticate(String token, HttpServletRequest request) {
        try {
            UserDto user = authServiceClient.authenticate(new AuthenticateRequest(token));
            if (user == null) {
                throw rejected();
            }
            log.debug("Authenticated: userId={}, path={}", user.id(), request.getRequestURI());
            return user;
        } catch (FeignException.Unauthorized e) {
            log.debug("Credential rejected by auth-service: path={}", request.getRequestURI());
            throw rejected();
        } catch (FeignException e) {
            // 연결 실패(RetryableException), 5xx 등 - 인증 서비스 장애. 호출자에게는 거부로만 보인다
            log.warn("auth-service call failed: status={}, path={}, cause={}",
                    e.status(), request.getRequestURI(), e.getMessage());
            throw rejected();
        }
    }

    private BusinessException rejected() {
        return new BusinessException(ErrorCode.UNAUTHORIZED);
    }
}
