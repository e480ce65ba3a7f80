package com.bookstay.auth.security;

import com.bookstay.auth.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * JWT 토큰 제공자 (JWT Token Provider)
 *
 * <p>HMAC-SHA256 서명 키는 인증 서비스만 가진다. 다른 서비스는 토큰을 직접 검증하지 않고
 * {@code authenticate} RPC로 이 컴포넌트에 검증을 맡긴다.</p>
 *
 * <h3>토큰 구조 (JWT Claims)</h3>
 * <pre>
 *   Header:  {"alg": "HS256"}
 *   Payload: {"sub": "65f1c0ffee...",   ← userId (문서 id)
 *             "iat": 1700000000,        ← 발급 시각
 *             "exp": 1700003600}        ← 만료 시각 = 발급 시각 + jwt.expiration(초)
 * </pre>
 */
@Component
public class JwtTokenProvider {

    private final SecretKey key;           // HMAC-SHA256 서명 키
    private final long expirationSeconds;  // 토큰 수명 (초)

    public JwtTokenProvider(JwtProperties properties) {
        this.key = new SecretKeySpec(
                properties.secret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.expirationSeconds = properties.expiration();
    }

    /**
     * JWT 토큰 생성. subject에 userId를 저장한다.
     */
    public IssuedToken createToken(String userId) {
        Instant now = Instant.now();
        Instant expiresAt = now.plusSeconds(expirationSeconds);
        String token = Jwts.builder()
                .subject(userId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(key)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * 서명과 만료를 검증하고 subject(userId)를 반환한다.
     *
     * @throws JwtException             서명 불일치, 만료, 형식 오류
     * @throws IllegalArgumentException 토큰이 null이거나 빈 문자열
     */
    public String getUserId(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
        return claims.getSubject();
    }

    /**
     * 발급된 토큰과 만료 시각. 만료 시각은 쿠키 수명 계산에 쓰인다.
     */
    public record IssuedToken(String value, Instant expiresAt) {}
}
