package com.bookstay.reservations.service;

import com.bookstay.common.command.ChargeResponse;
import com.bookstay.common.command.CreateChargeCommand;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import com.bookstay.reservations.document.ReservationDocument;
import com.bookstay.reservations.dto.ChargeRequest;
import com.bookstay.reservations.dto.CreateReservationRequest;
import com.bookstay.reservations.dto.UpdateReservationRequest;
import com.bookstay.reservations.repository.ReservationsRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.query.Update;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ReservationsServiceTest {

    private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-06-05T00:00:00Z");
    private static final UserDto USER = new UserDto("65f1c0ffee", "a@x.com");

    @Mock
    private ReservationsRepository reservationsRepository;
    @Mock
    private ReservationChargeService reservationChargeService;

    @InjectMocks
    private ReservationsService reservationsService;

    @Test
    @DisplayName("예약 생성 - 결제 후 거래 ID를 invoiceId로 저장")
    void create_Success() {
        // Given
        CreateReservationRequest request = new CreateReservationRequest(START, END, "place-1",
                new ChargeRequest(new BigDecimal("5"), "pm_card_visa"));
        given(reservationChargeService.charge(any(CreateChargeCommand.class)))
                .willReturn(new ChargeResponse("pi_123", new BigDecimal("5"), "succeeded"));
        given(reservationsRepository.create(any(ReservationDocument.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

        // When
        ReservationDocument result = reservationsService.create(request, USER);

        // Then
        assertThat(result.getInvoiceId()).isEqualTo("pi_123");
        assertThat(result.getUserId()).isEqualTo("65f1c0ffee");
        assertThat(result.getStartDate()).isEqualTo(START);
        assertThat(result.getTimestamp()).isNotNull();
        verify(reservationChargeService).charge(
                new CreateChargeCommand("a@x.com", new BigDecimal("5"), "pm_card_visa"));
    }

    @Test
    @DisplayName("종료일이 시작일보다 빠르면 결제 없이 거부")
    void create_InvalidPeriod() {
        CreateReservationRequest request = new CreateReservationRequest(END, START, "place-1",
                new ChargeRequest(new BigDecimal("5"), "pm_card_visa"));

        assertThatThrownBy(() -> reservationsService.create(request, USER))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_RESERVATION_PERIOD);
        verifyNoInteractions(reservationChargeService, reservationsRepository);
    }

    @Test
    @DisplayName("결제 회로가 열려 있어도 기간 검증이 먼저 - 잘못된 기간은 INVALID_RESERVATION_PERIOD")
    void create_InvalidPeriodWhileChargeUnavailable() {
        CreateReservationRequest valid = new CreateReservationRequest(START, END, "place-1",
                new ChargeRequest(new BigDecimal("5"), "pm_card_visa"));
        CreateReservationRequest invalid = new CreateReservationRequest(END, START, "place-1",
                new ChargeRequest(new BigDecimal("5"), "pm_card_visa"));
        given(reservationChargeService.charge(any(CreateChargeCommand.class)))
                .willThrow(new BusinessException(ErrorCode.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> reservationsService.create(valid, USER))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.SERVICE_UNAVAILABLE);
        assertThatThrownBy(() -> reservationsService.create(invalid, USER))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_RESERVATION_PERIOD);
        verify(reservationChargeService, times(1)).charge(any(CreateChargeCommand.class));
        verifyNoInteractions(reservationsRepository);
    }

    @Test
    @DisplayName("부분 수정 - null이 아닌 필드만 업데이트에 포함")
    void update_OnlyNonNullFields() {
        // Given
        ReservationDocument current = ReservationDocument.builder()
                .startDate(START).endDate(END).userId("65f1c0ffee").placeId("place-1").build();
        Instant newEnd = Instant.parse("2024-06-10T00:00:00Z");
        given(reservationsRepository.getById("r1")).willReturn(current);
        given(reservationsRepository.update(eq("r1"), any(Update.class))).willReturn(current);

        // When
        reservationsService.update("r1", new UpdateReservationRequest(null, newEnd, null));

        // Then
        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(reservationsRepository).update(eq("r1"), captor.capture());
        Update update = captor.getValue();
        assertThat(update.modifies("endDate")).isTrue();
        assertThat(update.modifies("startDate")).isFalse();
        assertThat(update.modifies("placeId")).isFalse();
        assertThat(update.modifies("userId")).isFalse();
    }

    @Test
    @DisplayName("부분 수정 - 새 종료일이 저장된 시작일보다 빠르면 거부")
    void update_InvalidPeriodAgainstStored() {
        ReservationDocument current = ReservationDocument.builder()
                .startDate(START).endDate(END).userId("65f1c0ffee").build();
        given(reservationsRepository.getById("r1")).willReturn(current);

        assertThatThrownBy(() -> reservationsService.update("r1",
                new UpdateReservationRequest(null, START.minusSeconds(3600), null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_RESERVATION_PERIOD);
        verify(reservationsRepository, never()).update(any(), any());
    }

    @Test
    @DisplayName("없는 예약 삭제는 NotFound 그대로 전달")
    void remove_NotFound() {
        given(reservationsRepository.delete("missing"))
                .willThrow(new BusinessException(ErrorCode.ENTITY_NOT_FOUND));

        assertThatThrownBy(() -> reservationsService.remove("missing"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ENTITY_NOT_FOUND);
    }
}
