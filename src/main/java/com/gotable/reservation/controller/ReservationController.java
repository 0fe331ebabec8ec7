package com.gotable.reservation.controller;

import com.gotable.common.dto.ApiResponse;
import com.gotable.common.security.LoginUser;
import com.gotable.reservation.dto.CancelReservationResponse;
import com.gotable.reservation.dto.CreateReservationRequest;
import com.gotable.reservation.dto.ReservationResponse;
import com.gotable.reservation.service.ReservationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 예약 API 컨트롤러 - 모든 엔드포인트 인증 필요.
 *
 * <h3>API 목록</h3>
 * <ul>
 *   <li>POST /api/reservations - 예약 생성 (201)</li>
 *   <li>GET /api/reservations - 내 예약 목록</li>
 *   <li>DELETE /api/reservations/{id} - 예약 취소 (결제 예약은 환불 시도)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ReservationResponse> create(@LoginUser Long userId,
                                                   @Valid @RequestBody CreateReservationRequest request) {
        return ApiResponse.ok(reservationService.createReservation(userId, request));
    }

    @GetMapping
    public ApiResponse<List<ReservationResponse>> list(@LoginUser Long userId) {
        return ApiResponse.ok(reservationService.getReservations(userId));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<CancelReservationResponse> cancel(@LoginUser Long userId, @PathVariable Long id) {
        return ApiResponse.ok(reservationService.cancelReservation(userId, id));
    }
}
