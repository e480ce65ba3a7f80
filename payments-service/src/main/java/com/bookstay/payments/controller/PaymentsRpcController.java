package com.bookstay.payments.controller;

import com.bookstay.common.command.ChargeResponse;
import com.bookstay.common.command.CreateChargeCommand;
import com.bookstay.payments.service.PaymentsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

// 서비스 간 RPC - reservations-service의 PaymentsServiceClient가 호출한다
@RestController
@RequestMapping("/rpc")
@RequiredArgsConstructor
public class PaymentsRpcController {

    private final PaymentsService paymentsService;

    @PostMapping("/" + CreateChargeCommand.OPERATION)
    public ChargeResponse createCharge(@Valid @RequestBody CreateChargeCommand command) {
        return paymentsService.createCharge(command);
    }
}
