package com.bookstay.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 - HTTP 상태 코드와 에러 메시지를 표준화한다.
 *
 * <p>에러 분류:
 * - NotFound: ENTITY_NOT_FOUND (문서가 없음, 호출자가 복구 가능한 정상적인 음성 결과)
 * - Unauthorized: UNAUTHORIZED (자격 증명 누락/만료/불일치 - 세부 사유는 노출하지 않는다)
 * - Conflict: DUPLICATE_EMAIL (고유성 위반)
 * - Unavailable: DATABASE_UNAVAILABLE, SERVICE_UNAVAILABLE (저장소/원격 서비스 장애)</p>
 *
 * <p>모든 서비스가 이 enum을 공유하므로 클라이언트는 어느 서비스의 에러든
 * 같은 방식으로 처리할 수 있다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    // === 공통 에러 코드 ===
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Entity not found"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),
    DATABASE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Database temporarily unavailable"),

    // === 인증(Auth) 도메인 에러 코드 ===
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Unauthorized"),
    DUPLICATE_EMAIL(HttpStatus.CONFLICT, "Email already exists"),

    // === 예약(Reservation) 도메인 에러 코드 ===
    INVALID_RESERVATION_PERIOD(HttpStatus.BAD_REQUEST, "Reservation end date must be after start date"),

    // === 결제(Payment) 도메인 에러 코드 ===
    PAYMENT_FAILED(HttpStatus.BAD_REQUEST, "Payment processing failed");

    private final HttpStatus status;   // HTTP 응답 상태 코드
    private final String message;      // 클라이언트에 전달할 에러 메시지 (영문)
}
