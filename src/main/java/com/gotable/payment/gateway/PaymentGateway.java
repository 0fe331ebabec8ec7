package com.gotable.payment.gateway;

import java.util.Map;

/**
 * 외부 결제 제공자 포트.
 * 모든 실패는 {@code GATEWAY_ERROR} 또는 {@code GATEWAY_NOT_CONFIGURED}를 담은
 * {@link com.gotable.common.exception.BusinessException}으로 올라온다.
 */
public interface PaymentGateway {

    /**
     * 설정된 통화로 정확히 {@code amount}만큼의 결제 의도를 생성한다.
     */
    PaymentIntent createPaymentIntent(long amount, Map<String, String> metadata);

    PaymentIntent retrievePaymentIntent(String paymentIntentId);

    /**
     * 완료된 청구를 환불한다. amount가 null이면 전액 환불.
     */
    Refund createRefund(String chargeId, Long amount);
}
