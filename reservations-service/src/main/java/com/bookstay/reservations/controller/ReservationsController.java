package com.bookstay.reservations.controller;

import com.bookstay.common.dto.ApiResponse;
import com.bookstay.common.dto.UserDto;
import com.bookstay.common.security.CurrentUser;
import com.bookstay.reservations.document.ReservationDocument;
import com.bookstay.reservations.dto.CreateReservationRequest;
import com.bookstay.reservations.dto.UpdateReservationRequest;
import com.bookstay.reservations.service.ReservationsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 예약 API. {@code /reservations/**} 전체가 위임 인증 가드로 보호된다.
 */
@RestController
@RequestMapping("/reservations")
@RequiredArgsConstructor
public class ReservationsController {

    private final ReservationsService reservationsService;

    // 예약 생성 - 결제까지 동기적으로 끝난 뒤 응답
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ReservationDocument> create(@Valid @RequestBody CreateReservationRequest request,
                                                   @CurrentUser UserDto user) {
        return ApiResponse.ok(reservationsService.create(request, user));
    }

    @GetMapping
    public ApiResponse<List<ReservationDocument>> findAll() {
        return ApiResponse.ok(reservationsService.findAll());
    }

    // 로그인한 사용자의 예약 목록
    @GetMapping("/mine")
    public ApiResponse<List<ReservationDocument>> findMine(@CurrentUser UserDto user) {
        return ApiResponse.ok(reservationsService.findByUser(user.id()));
    }

    @GetMapping("/{id}")
    public ApiResponse<ReservationDocument> findOne(@PathVariable String id) {
        return ApiResponse.ok(reservationsService.findOne(id));
    }

    @PatchMapping("/{id}")
    public ApiResponse<ReservationDocument> update(@PathVariable String id,
                                                   @RequestBody UpdateReservationRequest request) {
        return ApiResponse.ok(reservationsService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<ReservationDocument> remove(@PathVariable String id) {
        return ApiResponse.ok(reservationsService.remove(id));
    }
}
