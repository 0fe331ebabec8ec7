package com.gotable.payment.gateway;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stripe 기반 {@link PaymentGateway} 구현.
 *
 * <h3>장애 처리</h3>
 * <pre>
 * 1. FeignException          → GATEWAY_ERROR (원인 예외 보존)
 * 2. 시크릿 키 미설정          → GATEWAY_NOT_CONFIGURED (외부 호출 없음)
 * 3. 연속 실패 → CircuitBreaker Open → Fallback → GATEWAY_ERROR
 * </pre>
 *
 * <p>트랜잭션 밖에서 호출되며 재시도하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripePaymentGateway implements PaymentGateway {

    private static final String CIRCUIT_BREAKER = "paymentGateway";

    private final StripeApiClient stripeApiClient;
    private final StripeProperties properties;

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "createPaymentIntentFallback")
    public PaymentIntent createPaymentIntent(long amount, Map<String, String> metadata) {
        requireSecretKey();

        Map<String, Object> form = new LinkedHashMap<>();
        form.put("amount", amount);
        form.put("currency", properties.currency());
        form.put("automatic_payment_methods[enabled]", true);
        metadata.forEach((key, value) -> form.put("metadata[" + key + "]", value));

        try {
            PaymentIntent intent = stripeApiClient.createPaymentIntent(form);
            log.info("Payment intent created: id={}, amount={}", intent.id(), amount);
            return intent;
        } catch (FeignException e) {
            throw gatewayError("create payment intent", e);
        }
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "retrievePaymentIntentFallback")
    public PaymentIntent retrievePaymentIntent(String paymentIntentId) {
        requireSecretKey();
        try {
            return stripeApiClient.retrievePaymentIntent(paymentIntentId);
        } catch (FeignException e) {
            throw gatewayError("retrieve payment intent " + paymentIntentId, e);
        }
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "createRefundFallback")
    public Refund createRefund(String chargeId, Long amount) {
        requireSecretKey();

        Map<String, Object> form = new LinkedHashMap<>();
        form.put("charge", chargeId);
        if (amount != null) {
            form.put("amount", amount);
        }

        try {
            Refund refund = stripeApiClient.createRefund(form);
            log.info("Refund created: id={}, charge={}, amount={}", refund.id(), chargeId, refund.amount());
            return refund;
        } catch (FeignException e) {
            throw gatewayError("refund charge " + chargeId, e);
        }
    }

    private void requireSecretKey() {
        if (!properties.hasSecretKey()) {
            throw new BusinessException(ErrorCode.GATEWAY_NOT_CONFIGURED, "Stripe secret key is not configured");
        }
    }

    private BusinessException gatewayError(String operation, FeignException e) {
        log.warn("Stripe call failed: operation={}, status={}", operation, e.status());
        return new BusinessException(ErrorCode.GATEWAY_ERROR, "Payment gateway failed to " + operation, e);
    }

    // Fallback: 비즈니스 예외는 그대로, 그 외(Open 상태 포함)는 GATEWAY_ERROR

    @SuppressWarnings("unused")
    private PaymentIntent createPaymentIntentFallback(long amount, Map<String, String> metadata, Throwable t) {
        throw translate(t);
    }

    @SuppressWarnings("unused")
    private PaymentIntent retrievePaymentIntentFallback(String paymentIntentId, Throwable t) {
        throw translate(t);
    }

    @SuppressWarnings("unused")
    private Refund createRefundFallback(String chargeId, Long amount, Throwable t) {
        throw translate(t);
    }

    private BusinessException translate(Throwable t) {
        if (t instanceof BusinessException businessException) {
            return businessException;
        }
        log.warn("Payment gateway unavailable: {}", t.getMessage());
        return new BusinessException(ErrorCode.GATEWAY_ERROR, "Payment gateway is temporarily unavailable", t);
    }
}
