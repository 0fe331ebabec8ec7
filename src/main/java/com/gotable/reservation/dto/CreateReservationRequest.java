package com.gotable.reservation.dto;

import com.gotable.menu.dto.MenuItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 예약 생성 요청. {@code payment_intent_id}가 있으면 결제 완료 예약으로 검증 후 기록한다.
 */
public record CreateReservationRequest(
        @NotNull
        LocalDate reservationDate,

        @NotNull
        LocalTime reservationTime,

        @NotNull @Positive
        Integer numberOfPeople,

        @Size(max = 1000)
        String specialRequests,

        List<@Valid MenuItemRequest> menuItems,

        @Size(max = 255)
        String paymentIntentId
) {

    public List<MenuItemRequest> menuItemsOrEmpty() {
        return menuItems != null ? menuItems : List.of();
    }

    public boolean hasPayment() {
        return paymentIntentId != null && !paymentIntentId.isBlank();
    }
}
