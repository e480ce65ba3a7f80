package com.bookstay.common.security;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 컨트롤러 파라미터에 인증된 {@link com.bookstay.common.dto.UserDto}를 주입한다.
 *
 * <pre>{@code
 * @PostMapping
 * public ApiResponse<ReservationDocument> create(@RequestBody CreateReservationRequest request,
 *                                                @CurrentUser UserDto user) { ... }
 * }</pre>
 *
 * 가드를 통과하지 않은 요청에서는 {@code UNAUTHORIZED}가 발생한다.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface CurrentUser {
}
