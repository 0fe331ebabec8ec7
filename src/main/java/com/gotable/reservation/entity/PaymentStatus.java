package com.gotable.reservation.entity;

/**
 * 예약의 결제 상태. 생성 이후 적용되는 전이는 SUCCEEDED → REFUNDED 하나뿐이다.
 */
public enum PaymentStatus {
    PENDING,
    SUCCEEDED,
    REFUNDED
}
