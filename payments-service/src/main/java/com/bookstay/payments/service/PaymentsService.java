package com.bookstay.payments.service;

import com.bookstay.common.command.ChargeResponse;
import com.bookstay.common.command.CreateChargeCommand;
import com.bookstay.common.event.NotifyEmailEvent;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import com.bookstay.payments.event.NotificationEventPublisher;
import com.bookstay.payments.gateway.PaymentGateway;
import com.bookstay.payments.gateway.PaymentGateway.PaymentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 결제 처리: 게이트웨이 승인 → 알림 이벤트 발행 → 거래 ID 반환.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentsService {

    private final PaymentGateway paymentGateway;
    private final NotificationEventPublisher eventPublisher;

    public ChargeResponse createCharge(CreateChargeCommand command) {
        log.info("Processing charge: amount={}", command.amount());

        PaymentResult result = paymentGateway.charge(command.amount(), command.paymentMethodId());
        if (!result.success()) {
            throw new BusinessException(ErrorCode.PAYMENT_FAILED);
        }

        eventPublisher.publishNotifyEmail(new NotifyEmailEvent(command.email(),
                "Payment of $" + command.amount().toPlainString() + " has completed successfully."));

        log.info("Charge completed: transactionId={}", result.transactionId());
        return new ChargeResponse(result.transactionId(), command.amount(), result.status());
    }
}
