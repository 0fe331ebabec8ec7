package com.gotable.reservation.entity;

/** 예약 상태. 현재 흐름에서는 PENDING으로만 생성된다. */
public enum ReservationStatus {
    PENDING,
    CONFIRMED,
    CANCELLED
}
