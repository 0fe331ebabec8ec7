package com.gotable.reservation.service;

import com.gotable.menu.dto.MenuItemRequest;
import com.gotable.reservation.entity.PaymentStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 예약과 메뉴 항목을 기록하는 데 필요한 값.
 * 메뉴 항목은 이미 병합되어 메뉴당 하나씩이어야 한다.
 */
public record ReservationDraft(
        Long userId,
        LocalDate reservationDate,
        LocalTime reservationTime,
        int numberOfPeople,
        String specialRequests,
        List<MenuItemRequest> items,
        String paymentIntentId,
        Long amount,
        PaymentStatus paymentStatus
) {

    public static ReservationDraft unpaid(Long userId, LocalDate date, LocalTime time, int numberOfPeople,
                                          String specialRequests, List<MenuItemRequest> items) {
        return new ReservationDraft(userId, date, time, numberOfPeople, specialRequests, items,
                null, null, PaymentStatus.PENDING);
    }

    public static ReservationDraft paid(Long userId, LocalDate date, LocalTime time, int numberOfPeople,
                                        String specialRequests, List<MenuItemRequest> items,
                                        String paymentIntentId, long amount) {
        return new ReservationDraft(userId, date, time, numberOfPeople, specialRequests, items,
                paymentIntentId, amount, PaymentStatus.SUCCEEDED);
    }
}
