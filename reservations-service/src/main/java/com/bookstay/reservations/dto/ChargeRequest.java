package com.bookstay.reservations.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * 예약 시 결제 정보. 이메일은 요청 본문이 아니라 인증된 사용자에게서 가져온다.
 */
public record ChargeRequest(
        @NotNull(message = "amount is required")
        @DecimalMin(value = "0.5", message = "amount must be at least 0.5")
        BigDecimal amount,

        @NotBlank(message = "paymentMethodId is required")
        String paymentMethodId
) {}
