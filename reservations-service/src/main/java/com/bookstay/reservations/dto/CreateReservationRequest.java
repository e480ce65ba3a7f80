package com.bookstay.reservations.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record CreateReservationRequest(
        @NotNull(message = "startDate is required")
        Instant startDate,

        @NotNull(message = "endDate is required")
        Instant endDate,

        @NotBlank(message = "placeId is required")
        String placeId,

        @NotNull(message = "charge is required")
        @Valid
        ChargeRequest charge
) {}
