package com.bookstay.common.security.guard;

import com.bookstay.common.dto.AuthenticateRequest;
import com.bookstay.common.dto.UserDto;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 인증 서비스(auth-service)의 {@code authenticate} RPC를 호출하는 OpenFeign 클라이언트.
 *
 * <p>요청/응답 모두 JSON이다. 인증 서비스는 토큰이 무효하면 401을 돌려주고,
 * Feign은 이를 {@code FeignException.Unauthorized}로 던진다.
 * 연결 실패/타임아웃은 {@code RetryableException}이 된다.</p>
 */
@FeignClient(name = "auth-service", url = "${auth-service.url}", configuration = AuthClientConfig.class)
public interface AuthServiceClient {

    // POST /rpc/authenticate → 토큰 검증 후 사용자 정보 반환
    @PostMapping("/rpc/" + AuthenticateRequest.OPERATION)
    UserDto authenticate(@RequestBody AuthenticateRequest request);
}
