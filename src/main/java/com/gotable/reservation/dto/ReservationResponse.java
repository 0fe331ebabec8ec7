package com.gotable.reservation.dto;

import com.gotable.reservation.entity.PaymentStatus;
import com.gotable.reservation.entity.Reservation;
import com.gotable.reservation.entity.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/** 예약 응답 - 메뉴 항목(이름, 단가, 수량)을 포함한다 */
public record ReservationResponse(
        Long id,
        Long userId,
        LocalDate reservationDate,
        LocalTime reservationTime,
        int numberOfPeople,
        String specialRequests,
        ReservationStatus status,
        String paymentIntentId,
        Long amount,
        PaymentStatus paymentStatus,
        LocalDateTime createdAt,
        List<ReservationMenuItemResponse> menuItems
) {

    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getUser().getId(),
                reservation.getReservationDate(),
                reservation.getReservationTime(),
                reservation.getNumberOfPeople(),
                reservation.getSpecialRequests(),
                reservation.getStatus(),
                reservation.getPaymentIntentId(),
                reservation.getAmount(),
                reservation.getPaymentStatus(),
                reservation.getCreatedAt(),
                reservation.getItems().stream()
                        .map(ReservationMenuItemResponse::from)
                        .toList());
    }
}
