package com.bookstay.payments.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Stripe 설정 ({@code stripe.*}).
 *
 * @param secretKey Stripe 비밀 키 (STRIPE_SECRET_KEY, 기본값 없음)
 * @param apiUrl    API 기본 URL
 * @param currency  결제 통화 (ISO 4217 소문자)
 */
@Validated
@ConfigurationProperties(prefix = "stripe")
public record StripeProperties(
        @NotBlank String secretKey,
        @NotBlank String apiUrl,
        @NotBlank String currency
) {}
