package com.bookstay.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * RFC 9457 ProblemDetail 형식의 글로벌 예외 처리기.
 *
 * <p>응답 예시:
 * <pre>{@code
 * {
 *   "type": "https://bookstay.dev/errors/entity_not_found",
 *   "title": "Entity not found",
 *   "status": 404,
 *   "detail": "ReservationDocument not found"
 * }
 * }</pre></p>
 *
 * <p>도메인 오류(4xx)는 WARN, 인프라 오류(5xx)는 ERROR로 기록한다.
 * 공통 모듈에 있으므로 각 서비스는 {@code scanBasePackages}에 이 패키지만 추가하면 된다.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * BusinessException 처리 - ErrorCode에 정의된 HTTP 상태와 메시지로 응답 생성.
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (e.isUnavailable()) {
            log.error("Infrastructure failure: code={}, message={}", errorCode, e.getMessage(), e);
        } else {
            log.warn("Business exception: code={}, message={}", errorCode, e.getMessage());
        }
        return toResponse(errorCode, e.getMessage());
    }

    // @Valid 요청 바디 검증 실패 - 어떤 필드가 잘못되었는지 detail에 담는다
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", detail);
        return toResponse(ErrorCode.INVALID_INPUT, detail);
    }

    /**
     * 예상치 못한 예외 처리 - 500 Internal Server Error로 응답.
     * 실제 예외 메시지는 클라이언트에 노출하지 않고 로그에만 기록한다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleException(Exception e) {
        log.error("Unexpected error", e);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        return ResponseEntity.internalServerError().body(problem);
    }

    private ResponseEntity<ProblemDetail> toResponse(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        // type URI: 클라이언트가 에러 종류를 코드로 구분할 수 있는 식별자
        problem.setType(URI.create("https://bookstay.dev/errors/" + errorCode.name().toLowerCase()));
        problem.setTitle(errorCode.getMessage());
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }
}
