package com.gotable.payment.controller;

import com.gotable.common.dto.ApiResponse;
import com.gotable.common.security.LoginUser;
import com.gotable.menu.dto.MenuItemRequest;
import com.gotable.payment.dto.CreatePaymentIntentResponse;
import com.gotable.payment.dto.PublishableKeyResponse;
import com.gotable.payment.dto.RefundResponse;
import com.gotable.payment.service.PaymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 결제 API 컨트롤러.
 *
 * <h3>API 목록</h3>
 * <ul>
 *   <li>POST /api/payments/create-intent - 메뉴 선택으로 결제 의도 생성 (인증 필요)</li>
 *   <li>POST /api/payments/refund/{paymentIntentId} - 본인 예약 결제 환불 (인증 필요)</li>
 *   <li>GET /api/stripe/publishable-key - 클라이언트용 공개 키 (인증 불필요)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    /** 결제 의도 생성 - 본문은 {menu_id, quantity} 배열, 검증은 서비스에서 정해진 순서로 수행 */
    @PostMapping("/payments/create-intent")
    public ApiResponse<CreatePaymentIntentResponse> createIntent(@LoginUser Long userId,
                                                                 @RequestBody List<MenuItemRequest> items) {
        return ApiResponse.ok(paymentService.createPaymentIntent(userId, items));
    }

    /** 결제 의도 ID로 본인 예약 환불 */
    @PostMapping("/payments/refund/{paymentIntentId}")
    public ApiResponse<RefundResponse> refund(@LoginUser Long userId, @PathVariable String paymentIntentId) {
        return ApiResponse.ok(paymentService.refundPayment(userId, paymentIntentId), "Refund completed");
    }

    /** Stripe 공개 키 조회 */
    @GetMapping("/stripe/publishable-key")
    public ApiResponse<PublishableKeyResponse> publishableKey() {
        return ApiResponse.ok(paymentService.publishableKey());
    }
}
