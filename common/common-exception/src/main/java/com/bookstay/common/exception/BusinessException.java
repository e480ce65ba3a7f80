package com.bookstay.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 - {@link ErrorCode} 기반으로 표준화된 예외를 던지는 커스텀 예외 클래스.
 *
 * <p>도메인 오류(NotFound, Unauthorized, Conflict)와 인프라 오류(Unavailable)를
 * 모두 이 예외 하나로 표현하고, 종류는 {@link ErrorCode}로 구분한다.
 * 호출자는 {@code getErrorCode()}로 두 범주를 구별할 수 있다.</p>
 *
 * <p>두 가지 생성자:
 * - {@code BusinessException(ErrorCode)}: 표준 에러 메시지 사용
 * - {@code BusinessException(ErrorCode, String)}: 상세 메시지 지정
 *   (예: "Reservation not found" 대신 "ReservationDocument not found: 65f1...")</p>
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }

    /** 저장소나 원격 서비스 장애처럼 재시도 대상인 인프라 오류인지 여부 */
    public boolean isUnavailable() {
        return errorCode.getStatus().is5xxServerError();
    }
}
