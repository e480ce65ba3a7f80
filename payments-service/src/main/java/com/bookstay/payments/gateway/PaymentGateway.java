package com.bookstay.payments.gateway;

import java.math.BigDecimal;

/**
 * 외부 결제 게이트웨이 추상화.
 *
 * <p>카드 거절처럼 게이트웨이가 정상 응답으로 거부한 경우는 {@code success=false}인
 * {@link PaymentResult}로 돌려준다. 게이트웨이에 닿지 못한 경우는 예외로 던진다.</p>
 */
public interface PaymentGateway {

    /** 결제수단으로 즉시 승인(confirm)까지 요청한다 */
    PaymentResult charge(BigDecimal amount, String paymentMethodId);

    /**
     * 게이트웨이 응답.
     *
     * @param success       승인 여부
     * @param transactionId 게이트웨이 거래 ID (실패 시 null일 수 있음)
     * @param status        게이트웨이 상태 문자열
     * @param message       실패 사유
     */
    record PaymentResult(boolean success, String transactionId, String status, String message) {

        public static PaymentResult approved(String transactionId, String status) {
            return new PaymentResult(true, transactionId, status, null);
        }

        public static PaymentResult declined(String message) {
            return new PaymentResult(false, null, null, message);
        }
    }
}
