package com.bookstay.common.command;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * 결제 요청 커맨드 - reservations-service → payments-service ({@code create-charge} RPC).
 *
 * @param email           결제 완료 알림을 받을 사용자 이메일
 * @param amount          결제 금액 (USD)
 * @param paymentMethodId 결제 게이트웨이의 결제수단 ID (예: Stripe의 "pm_card_visa")
 */
public record CreateChargeCommand(
        @NotBlank @Email
        String email,

        @NotNull @DecimalMin(value = "0.5", message = "amount must be at least 0.5")
        BigDecimal amount,

        @NotBlank(message = "paymentMethodId is required")
        String paymentMethodId
) {

    public static final String OPERATION = "create-charge";
}
