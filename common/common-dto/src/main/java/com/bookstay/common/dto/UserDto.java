package com.bookstay.common.dto;

/**
 * 인증된 사용자 정보 (Authenticated Identity).
 *
 * <p>인증 서비스의 {@code authenticate} RPC 응답이며, 가드가 요청 속성에 저장한다.
 * 요청마다 새로 만들어지고 소비 서비스에서는 절대 저장하지 않는다.
 * 비밀번호 해시는 포함하지 않는다.</p>
 */
public record UserDto(String id, String email) {}
