package com.bookstay.payments.gateway;

import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import com.bookstay.payments.config.StripeProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stripe PaymentIntents API 구현.
 *
 * <pre>
 * POST {apiUrl}/v1/payment_intents
 * Authorization: Bearer {secretKey}
 * Content-Type: application/x-www-form-urlencoded
 *
 * amount=500&amp;currency=usd&amp;payment_method=pm_card_visa&amp;confirm=true&amp;payment_method_types[]=card
 * </pre>
 *
 * <p>금액은 최소 통화 단위(센트)로 보낸다. 4xx 응답은 거절 결과로, 5xx 응답과 연결 실패는
 * SERVICE_UNAVAILABLE 예외로 구분한다.</p>
 */
@Slf4j
@Component
public class StripePaymentGateway implements PaymentGateway {

    private static final String PAYMENT_INTENTS = "/v1/payment_intents";
    private static final String SUCCEEDED = "succeeded";

    private final RestClient restClient;
    private final String currency;

    public StripePaymentGateway(RestClient.Builder restClientBuilder, StripeProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.apiUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.secretKey())
                .build();
        this.currency = properties.currency();
    }

    @Override
    public PaymentResult charge(BigDecimal amount, String paymentMethodId) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("amount", toMinorUnits(amount));
        form.add("currency", currency);
        form.add("payment_method", paymentMethodId);
        form.add("confirm", "true");
        form.add("payment_method_types[]", "card");

        try {
            PaymentIntent intent = restClient.post()
                    .uri(PAYMENT_INTENTS)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(PaymentIntent.class);
            if (intent == null || !SUCCEEDED.equals(intent.status())) {
                String status = intent == null ? "empty response" : intent.status();
                log.warn("Payment intent not succeeded: status={}", status);
                return PaymentResult.declined("Payment intent status: " + status);
            }
            return PaymentResult.approved(intent.id(), intent.status());
        } catch (HttpClientErrorException e) {
            // 4xx: 카드 거절, 잘못된 결제수단 등
            log.warn("Stripe rejected charge: status={}, body={}",
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            return PaymentResult.declined(e.getStatusText());
        } catch (HttpServerErrorException e) {
            // 5xx: Stripe 장애는 거절이 아니다
            log.error("Stripe failed: status={}", e.getStatusCode().value(), e);
            throw unavailable(e);
        } catch (ResourceAccessException e) {
            log.error("Stripe unreachable", e);
            throw unavailable(e);
        }
    }

    private static BusinessException unavailable(Exception cause) {
        return new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                "Payment gateway is temporarily unavailable", cause);
    }

    private static String toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).toPlainString();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PaymentIntent(String id, long amount, String status) {}
}
