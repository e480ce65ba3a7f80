package com.bookstay.common.dto;

/**
 * {@code authenticate} RPC 요청 바디: {@code { "token": "eyJhbGci..." }}
 */
public record AuthenticateRequest(String token) {

    /** 가드와 인증 서비스가 공유하는 RPC 오퍼레이션 이름 */
    public static final String OPERATION = "authenticate";
}
