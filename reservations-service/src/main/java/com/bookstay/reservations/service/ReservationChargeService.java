package com.bookstay.reservations.service;

import com.bookstay.common.command.ChargeResponse;
import com.bookstay.common.command.CreateChargeCommand;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import com.bookstay.reservations.client.PaymentsServiceClient;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * payments-service {@code create-charge} 호출을 Circuit Breaker로 감싼다.
 *
 * <p>회로가 열려 있을 때 거부되는 것은 결제 호출뿐이다. 예약 기간 검증과 저장은
 * 회로 상태와 무관하게 {@link ReservationsService}가 수행한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationChargeService {

    private final PaymentsServiceClient paymentsServiceClient;

    @CircuitBreaker(name = "paymentsService", fallbackMethod = "chargeFallback")
    public ChargeResponse charge(CreateChargeCommand command) {
        return paymentsServiceClient.createCharge(command);
    }

    /**
     * Circuit Breaker 폴백.
     *
     * <p>결제 거절(4xx)은 PAYMENT_FAILED, 그 외(연결 실패, 타임아웃, 5xx, 회로 OPEN)는
     * SERVICE_UNAVAILABLE.</p>
     */
    ChargeResponse chargeFallback(CreateChargeCommand command, Throwable t) {
        if (t instanceof FeignException feignException && is4xx(feignException.status())) {
            log.warn("Charge rejected: status={}", feignException.status());
            throw new BusinessException(ErrorCode.PAYMENT_FAILED);
        }
        log.warn("Payments service unavailable, charge not created: {}", t.toString());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                "Payments service is temporarily unavailable. Please try again later.", t);
    }

    private static boolean is4xx(int status) {
        return status >= 400 && status < 500;
    }
}
