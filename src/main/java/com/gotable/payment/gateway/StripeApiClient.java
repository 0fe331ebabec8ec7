package com.gotable.payment.gateway;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;

import java.util.Map;

/**
 * Stripe REST API 클라이언트.
 *
 * <p>요청 본문은 form 인코딩이며 중첩 키는 Stripe의 대괄호 표기
 * ({@code metadata[user_id]})를 쓴다. 응답은 snake_case JSON이다.</p>
 */
@FeignClient(name = "stripe", url = "${payment.stripe.base-url:https://api.stripe.com}",
        configuration = StripeFeignConfig.class)
public interface StripeApiClient {

    @PostMapping(value = "/v1/payment_intents", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    PaymentIntent createPaymentIntent(Map<String, ?> form);

    @GetMapping("/v1/payment_intents/{id}")
    PaymentIntent retrievePaymentIntent(@PathVariable("id") String paymentIntentId);

    @PostMapping(value = "/v1/refunds", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    Refund createRefund(Map<String, ?> form);
}
