package com.bookstay.reservations.dto;

import java.time.Instant;

/**
 * 부분 수정 요청 - null인 필드는 변경하지 않는다.
 * userId, invoiceId, timestamp는 수정 대상이 아니다.
 */
public record UpdateReservationRequest(
        Instant startDate,
        Instant endDate,
        String placeId
) {

    public boolean isEmpty() {
        return startDate == null && endDate == null && placeId == null;
    }
}
