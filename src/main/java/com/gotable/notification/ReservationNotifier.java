package com.gotable.notification;

import com.gotable.reservation.entity.Reservation;

/**
 * 예약 변경 알림 발송.
 * 구현체는 예외를 던질 수 있으며, 호출 측은 알림 실패를 무시하고 본 흐름을 계속한다.
 */
public interface ReservationNotifier {

    void reservationConfirmed(Reservation reservation);

    void reservationCancelled(Reservation reservation);
}
