package com.gotable.reservation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gotable.payment.dto.RefundResponse;

/**
 * 예약 취소 응답. {@code refund}는 취소 중 환불이 실제로 이루어졌을 때만 포함된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelReservationResponse(String message, Long reservationId, RefundResponse refund) {}
