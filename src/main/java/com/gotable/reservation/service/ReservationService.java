package com.gotable.reservation.service;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import com.gotable.menu.dto.MenuItemRequest;
import com.gotable.notification.ReservationNotifier;
import com.gotable.payment.dto.RefundResponse;
import com.gotable.payment.service.PaymentService;
import com.gotable.reservation.dto.CancelReservationResponse;
import com.gotable.reservation.dto.CreateReservationRequest;
import com.gotable.reservation.dto.ReservationResponse;
import com.gotable.reservation.entity.Reservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 예약 유스케이스 (생성, 목록, 취소).
 *
 * <h3>생성</h3>
 * <pre>
 * 1. 중복 메뉴 병합
 * 2. [결제 예약] 미사용 결제 의도 → 결제 완료 → 금액 == Σ 가격 × 수량
 * 3. ledger.record (트랜잭션 하나로 예약 + 메뉴 항목)
 * 4. 메뉴 항목과 함께 다시 조회
 * 5. 알림 (실패 무시)
 * </pre>
 *
 * <h3>취소</h3>
 * <pre>
 * 1. 본인 예약 조회
 * 2. [결제 예약] 환불 (실패해도 취소는 진행)
 * 3. 본인 소유 조건부 삭제, 0행 → RESERVATION_NOT_FOUND
 * 4. 알림 (실패 무시)
 * </pre>
 *
 * 자체 트랜잭션은 없다. 게이트웨이와 알림 호출은 원장 트랜잭션 밖에서 실행된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final String CANCELLED_MESSAGE = "Reservation cancelled";

    private final ReservationLedger reservationLedger;
    private final PaymentService paymentService;
    private final ReservationNotifier reservationNotifier;

    public ReservationResponse createReservation(Long userId, CreateReservationRequest request) {
        List<MenuItemRequest> items = MenuItemRequest.mergeDuplicates(request.menuItemsOrEmpty());

        ReservationDraft draft;
        if (request.hasPayment()) {
            long amount = paymentService.verifyCapturedPayment(request.paymentIntentId(), items);
            draft = ReservationDraft.paid(userId, request.reservationDate(), request.reservationTime(),
                    request.numberOfPeople(), request.specialRequests(), items,
                    request.paymentIntentId(), amount);
        } else {
            draft = ReservationDraft.unpaid(userId, request.reservationDate(), request.reservationTime(),
                    request.numberOfPeople(), request.specialRequests(), items);
        }

        Long reservationId = reservationLedger.record(draft);
        Reservation reservation = reservationLedger.getOwned(reservationId, userId);
        log.info("Reservation created: reservationId={}, userId={}, paymentStatus={}",
                reservationId, userId, reservation.getPaymentStatus());

        notifyQuietly(reservation, true);
        return ReservationResponse.from(reservation);
    }

    public List<ReservationResponse> getReservations(Long userId) {
        return reservationLedger.listOwned(userId).stream()
                .map(ReservationResponse::from)
                .toList();
    }

    public CancelReservationResponse cancelReservation(Long userId, Long reservationId) {
        Reservation reservation = reservationLedger.getOwned(reservationId, userId);

        RefundResponse refund = reservation.isRefundable() ? refundQuietly(reservation) : null;

        if (!reservationLedger.deleteOwned(reservationId, userId)) {
            if (refund != null) {
                log.warn("Refund issued but reservation already deleted: reservationId={}, refundId={}, amount={}",
                        reservationId, refund.refundId(), refund.amount());
            }
            throw new BusinessException(ErrorCode.RESERVATION_NOT_FOUND);
        }
        log.info("Reservation cancelled: reservationId={}, userId={}, refunded={}",
                reservationId, userId, refund != null);

        notifyQuietly(reservation, false);
        return new CancelReservationResponse(CANCELLED_MESSAGE, reservationId, refund);
    }

    private RefundResponse refundQuietly(Reservation reservation) {
        RefundResponse refund;
        try {
            refund = paymentService.refundCapturedPayment(reservation);
        } catch (RuntimeException e) {
            log.warn("Refund failed, cancelling without refund: reservationId={}, paymentIntentId={}, cause={}",
                    reservation.getId(), reservation.getPaymentIntentId(), e.getMessage());
            return null;
        }

        try {
            reservationLedger.markRefunded(reservation.getId());
        } catch (RuntimeException e) {
            log.warn("Refund issued but payment status not updated: reservationId={}, refundId={}, cause={}",
                    reservation.getId(), refund.refundId(), e.getMessage());
        }
        return refund;
    }

    private void notifyQuietly(Reservation reservation, boolean confirmed) {
        try {
            if (confirmed) {
                reservationNotifier.reservationConfirmed(reservation);
            } else {
                reservationNotifier.reservationCancelled(reservation);
            }
        } catch (RuntimeException e) {
            log.warn("Reservation notification failed: reservationId={}, confirmed={}, cause={}",
                    reservation.getId(), confirmed, e.getMessage());
        }
    }
}
