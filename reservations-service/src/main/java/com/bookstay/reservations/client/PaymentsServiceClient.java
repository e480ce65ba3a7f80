package com.bookstay.reservations.client;

import com.bookstay.common.command.ChargeResponse;
import com.bookstay.common.command.CreateChargeCommand;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 결제 서비스(payments-service)의 {@code create-charge} RPC 클라이언트.
 *
 * <p>결제 실패(카드 거절 등)는 400으로 돌아와 {@code FeignException.BadRequest}가 되고,
 * 연결 실패/타임아웃은 {@code RetryableException}이 된다. 두 경우의 구분은
 * {@code ReservationsService}의 Circuit Breaker 폴백이 담당한다.</p>
 */
@FeignClient(name = "payments-service", url = "${payments-service.url}", configuration = PaymentsClientConfig.class)
public interface PaymentsServiceClient {

    @PostMapping("/rpc/" + CreateChargeCommand.OPERATION)
    ChargeResponse createCharge(@RequestBody CreateChargeCommand command);
}
