package com.gotable.payment.service;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import com.gotable.menu.dto.MenuItemRequest;
import com.gotable.menu.service.MenuQuote;
import com.gotable.menu.service.MenuService;
import com.gotable.payment.dto.CreatePaymentIntentResponse;
import com.gotable.payment.dto.PublishableKeyResponse;
import com.gotable.payment.dto.RefundResponse;
import com.gotable.payment.gateway.PaymentGateway;
import com.gotable.payment.gateway.PaymentIntent;
import com.gotable.payment.gateway.Refund;
import com.gotable.payment.gateway.StripeProperties;
import com.gotable.reservation.entity.PaymentStatus;
import com.gotable.reservation.entity.Reservation;
import com.gotable.reservation.service.ReservationLedger;
import com.gotable.user.entity.User;
import com.gotable.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 예약 흐름의 결제 담당 - 결제 의도 생성, 예약 전 결제 검증, 환불.
 *
 * <p>트랜잭션을 열지 않는다. 게이트웨이 호출은 DB 트랜잭션 안에서 실행하지 않으며,
 * 저장은 {@link ReservationLedger}가 짧은 트랜잭션으로 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentGateway paymentGateway;
    private final MenuService menuService;
    private final UserService userService;
    private final ReservationLedger reservationLedger;
    private final StripeProperties stripeProperties;

    /**
     * 선택한 메뉴의 현재 가격과 정확히 같은 금액으로 결제 의도를 생성한다.
     *
     * <pre>
     * 검사 순서:
     *   빈 선택          → NO_ITEMS_SELECTED
     *   수량 ≤ 0         → INVALID_INPUT
     *   없는 메뉴        → UNKNOWN_MENU
     *   판매 중지 메뉴   → MENU_UNAVAILABLE
     *   합계 ≤ 0         → NON_POSITIVE_TOTAL
     * </pre>
     * 모든 검사를 통과해야 게이트웨이를 호출한다.
     */
    public CreatePaymentIntentResponse createPaymentIntent(Long userId, List<MenuItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ErrorCode.NO_ITEMS_SELECTED);
        }
        User user = userService.getAuthenticatedUser(userId);

        MenuQuote quote = menuService.quote(MenuItemRequest.mergeDuplicates(items), true);
        if (quote.total() <= 0) {
            throw new BusinessException(ErrorCode.NON_POSITIVE_TOTAL);
        }

        PaymentIntent intent = paymentGateway.createPaymentIntent(quote.total(), Map.of(
                "user_id", String.valueOf(user.getId()),
                "user_email", user.getEmail()));

        log.info("Payment intent opened: userId={}, paymentIntentId={}, amount={}",
                userId, intent.id(), quote.total());
        return new CreatePaymentIntentResponse(intent.clientSecret(), intent.id(), quote.total());
    }

    /**
     * 결제 의도가 다른 예약에 쓰이지 않았고, 완료 상태이며, 선택한 메뉴 가격과
     * 정확히 같은 금액으로 결제되었는지 확인한다.
     *
     * @return 검증된 금액 (예약에 저장)
     */
    public long verifyCapturedPayment(String paymentIntentId, List<MenuItemRequest> items) {
        if (reservationLedger.isPaymentIntentUsed(paymentIntentId)) {
            throw new BusinessException(ErrorCode.PAYMENT_ALREADY_USED);
        }

        PaymentIntent intent = paymentGateway.retrievePaymentIntent(paymentIntentId);
        if (!intent.isSucceeded()) {
            throw new BusinessException(ErrorCode.PAYMENT_INCOMPLETE,
                    "Payment has not been completed: status=" + intent.status());
        }

        // 결제 시점에 가격이 확정되었으므로 판매 여부는 다시 보지 않음
        long expected = menuService.quote(items, false).total();
        if (intent.amount() == null || intent.amount() != expected) {
            log.warn("Payment amount mismatch: paymentIntentId={}, paid={}, expected={}",
                    paymentIntentId, intent.amount(), expected);
            throw new BusinessException(ErrorCode.PAYMENT_AMOUNT_MISMATCH);
        }
        return expected;
    }

    /**
     * {@code paymentIntentId}로 결제한 본인 예약의 직접 환불. 이미 환불됐으면 ALREADY_REFUNDED.
     */
    public RefundResponse refundPayment(Long userId, String paymentIntentId) {
        Reservation reservation = reservationLedger.findByPaymentIntent(paymentIntentId, userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESERVATION_NOT_FOUND,
                        "No reservation for this payment"));

        if (reservation.getPaymentStatus() == PaymentStatus.REFUNDED) {
            throw new BusinessException(ErrorCode.ALREADY_REFUNDED);
        }

        RefundResponse refund = refundCapturedPayment(reservation);
        reservationLedger.markRefunded(reservation.getId());
        return refund;
    }

    /**
     * 예약의 결제 금액을 게이트웨이에서 환불한다. 저장된 결제 상태는 바꾸지 않는다.
     */
    public RefundResponse refundCapturedPayment(Reservation reservation) {
        PaymentIntent intent = paymentGateway.retrievePaymentIntent(reservation.getPaymentIntentId());
        if (!intent.isSucceeded()) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_SUCCEEDED,
                    "Payment has not succeeded: status=" + intent.status());
        }
        if (!intent.hasCharge()) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_SUCCEEDED, "Payment has no charge to refund");
        }

        Long amount = reservation.getAmount() != null ? reservation.getAmount() : intent.amount();
        Refund refund = paymentGateway.createRefund(intent.latestCharge(), amount);

        log.info("Payment refunded: reservationId={}, paymentIntentId={}, refundId={}, amount={}",
                reservation.getId(), intent.id(), refund.id(), refund.amount());
        return RefundResponse.from(refund);
    }

    /** 클라이언트용 공개 키 - 미설정이면 GATEWAY_NOT_CONFIGURED */
    public PublishableKeyResponse publishableKey() {
        if (!stripeProperties.hasPublishableKey()) {
            throw new BusinessException(ErrorCode.GATEWAY_NOT_CONFIGURED, "Stripe publishable key is not configured");
        }
        return new PublishableKeyResponse(stripeProperties.publishableKey());
    }
}
