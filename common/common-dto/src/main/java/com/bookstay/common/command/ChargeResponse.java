package com.bookstay.common.command;

import java.math.BigDecimal;

/**
 * {@code create-charge} RPC 응답.
 *
 * @param id     게이트웨이 거래 ID - 예약 문서의 invoiceId로 저장된다
 * @param amount 결제된 금액
 * @param status 게이트웨이가 돌려준 상태 문자열 (예: "succeeded")
 */
public record ChargeResponse(String id, BigDecimal amount, String status) {}
