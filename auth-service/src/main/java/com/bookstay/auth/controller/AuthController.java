package com.bookstay.auth.controller;

import com.bookstay.auth.dto.LoginRequest;
import com.bookstay.auth.service.AuthService;
import com.bookstay.auth.service.AuthService.LoginResult;
import com.bookstay.common.dto.ApiResponse;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.security.BearerTokenResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;

/**
 * 로그인/로그아웃 API.
 *
 * <p>로그인 성공 시에만 {@code Authentication} HttpOnly 쿠키를 설정한다.
 * 토큰 재검증(authenticate)은 쿠키를 건드리지 않는다.</p>
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<UserDto>> login(@Valid @RequestBody LoginRequest request) {
        LoginResult result = authService.login(request.email(), request.password());
        ResponseCookie cookie = authenticationCookie(result.token(),
                Duration.between(Instant.now(), result.expiresAt()));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(ApiResponse.ok(result.user()));
    }

    // 쿠키를 즉시 만료시킨다. 발급된 토큰 자체는 만료 시각까지 유효하다
    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout() {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, authenticationCookie("", Duration.ZERO).toString())
                .body(ApiResponse.ok(null));
    }

    private ResponseCookie authenticationCookie(String value, Duration maxAge) {
        return ResponseCookie.from(BearerTokenResolver.AUTHENTICATION, value)
                .httpOnly(true)
                .path("/")
                .sameSite("Lax")
                .maxAge(maxAge)
                .build();
    }
}
