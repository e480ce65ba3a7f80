package com.bookstay.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 - 모든 서비스가 동일한 응답 포맷을 사용하는 표준 응답 객체.
 *
 * <p>success, data, message 세 필드로 구성되며 (에러 응답은 ProblemDetail로 따로 나간다),
 * {@code @JsonInclude(NON_NULL)}로 null 필드는 JSON에서 제외한다.</p>
 *
 * <p>서비스 간 RPC 응답({@code /rpc/**})에는 이 래퍼를 쓰지 않는다.
 * Feign 클라이언트가 페이로드 record를 그대로 역직렬화하도록 하기 위해서다.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message) {
    // 성공 응답 팩토리 메서드 - data만 포함
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }
}
