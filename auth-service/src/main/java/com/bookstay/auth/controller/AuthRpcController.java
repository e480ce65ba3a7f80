package com.bookstay.auth.controller;

import com.bookstay.auth.service.AuthService;
import com.bookstay.common.dto.AuthenticateRequest;
import com.bookstay.common.dto.UserDto;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 서비스 간 RPC 엔드포인트 - 다른 서비스의 {@code JwtAuthGuard}가 호출한다.
 *
 * <p>응답은 ApiResponse로 감싸지 않은 {@link UserDto}이다.
 * 무효 토큰이면 401 ProblemDetail을 돌려주고, 호출한 Feign 클라이언트는 이를
 * FeignException.Unauthorized로 받는다.</p>
 */
@RestController
@RequestMapping("/rpc")
@RequiredArgsConstructor
public class AuthRpcController {

    private final AuthService authService;

    @PostMapping("/" + AuthenticateRequest.OPERATION)
    public UserDto authenticate(@RequestBody AuthenticateRequest request) {
        return authService.authenticate(request.token());
    }
}
