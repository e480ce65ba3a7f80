package com.bookstay.auth.service;

import com.bookstay.auth.document.UserDocument;
import com.bookstay.auth.repository.UsersRepository;
import com.bookstay.auth.security.JwtTokenProvider;
import com.bookstay.auth.security.JwtTokenProvider.IssuedToken;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * 로그인(토큰 발급)과 토큰 검증(authenticate).
 *
 * <p>authenticate는 토큰 검증 후 매번 저장소에서 사용자를 다시 읽는다.
 * 토큰 발급 이후 삭제된 사용자의 토큰은 서명이 유효해도 거부된다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UsersService usersService;
    private final UsersRepository usersRepository;
    private final JwtTokenProvider jwtTokenProvider;

    public LoginResult login(String email, String password) {
        UserDocument user = usersService.verifyUser(email, password);
        IssuedToken token = jwtTokenProvider.createToken(user.getId());
        log.info("User logged in: userId={}", user.getId());
        return new LoginResult(user.toDto(), token.value(), token.expiresAt());
    }

    /**
     * 토큰의 서명/만료를 검증하고 토큰에 담긴 id로 사용자를 조회한다.
     * 어떤 이유로 실패하든 UNAUTHORIZED 하나로 응답한다.
     */
    public UserDto authenticate(String token) {
        String userId;
        try {
            userId = jwtTokenProvider.getUserId(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid token: {}", e.getMessage());
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        return usersRepository.findById(userId)
                .map(UserDocument::toDto)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNAUTHORIZED));
    }

    public record LoginResult(UserDto user, String token, Instant expiresAt) {}
}
