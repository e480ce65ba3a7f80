package com.bookstay.reservations.service;

import com.bookstay.common.command.ChargeResponse;
import com.bookstay.common.command.CreateChargeCommand;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import com.bookstay.reservations.document.ReservationDocument;
import com.bookstay.reservations.dto.CreateReservationRequest;
import com.bookstay.reservations.dto.UpdateReservationRequest;
import com.bookstay.reservations.repository.ReservationsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * 예약 비즈니스 로직.
 *
 * <h3>예약 생성 흐름</h3>
 * <ol>
 *   <li>기간 검증 (endDate &gt; startDate)</li>
 *   <li>{@link ReservationChargeService}로 결제 (Circuit Breaker 보호)</li>
 *   <li>결제 거래 ID를 invoiceId로 예약 문서 저장</li>
 * </ol>
 *
 * <p>결제가 성공한 뒤 저장이 실패하면 결제는 되돌리지 않는다. 이때 응답은
 * DATABASE_UNAVAILABLE이고 결제 내역은 게이트웨이 쪽에 남는다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationsService {

    private final ReservationsRepository reservationsRepository;
    private final ReservationChargeService reservationChargeService;

    public ReservationDocument create(CreateReservationRequest request, UserDto user) {
        validatePeriod(request.startDate(), request.endDate());
        log.info("Creating reservation: userId={}, placeId={}", user.id(), request.placeId());

        ChargeResponse charge = reservationChargeService.charge(new CreateChargeCommand(
                user.email(), request.charge().amount(), request.charge().paymentMethodId()));

        ReservationDocument reservation = reservationsRepository.create(ReservationDocument.builder()
                .timestamp(Instant.now())
                .startDate(request.startDate())
                .endDate(request.endDate())
                .userId(user.id())
                .placeId(request.placeId())
                .invoiceId(charge.id())
                .build());
        log.info("Reservation created: id={}, invoiceId={}", reservation.getId(), charge.id());
        return reservation;
    }

    public List<ReservationDocument> findAll() {
        return reservationsRepository.findAll();
    }

    public List<ReservationDocument> findByUser(String userId) {
        return reservationsRepository.findByUserId(userId);
    }

    public ReservationDocument findOne(String id) {
        return reservationsRepository.getById(id);
    }

    /**
     * 부분 수정. null이 아닌 필드만 하나의 원자적 업데이트로 적용한다.
     *
     * <p>날짜 중 하나만 바뀌는 경우 나머지 하나는 저장된 값과 비교해 기간을 검증한다.</p>
     */
    public ReservationDocument update(String id, UpdateReservationRequest request) {
        if (request.isEmpty()) {
            return reservationsRepository.getById(id);
        }
        if (request.startDate() != null || request.endDate() != null) {
            ReservationDocument current = (request.startDate() != null && request.endDate() != null)
                    ? null
                    : reservationsRepository.getById(id);
            validatePeriod(
                    request.startDate() != null ? request.startDate() : current.getStartDate(),
                    request.endDate() != null ? request.endDate() : current.getEndDate());
        }

        Update update = new Update();
        if (request.startDate() != null) {
            update.set("startDate", request.startDate());
        }
        if (request.endDate() != null) {
            update.set("endDate", request.endDate());
        }
        if (request.placeId() != null) {
            update.set("placeId", request.placeId());
        }
        return reservationsRepository.update(id, update);
    }

    public ReservationDocument remove(String id) {
        ReservationDocument removed = reservationsRepository.delete(id);
        log.info("Reservation removed: id={}", id);
        return removed;
    }

    private void validatePeriod(Instant startDate, Instant endDate) {
        if (!endDate.isAfter(startDate)) {
            throw new BusinessException(ErrorCode.INVALID_RESERVATION_PERIOD);
        }
    }
}
