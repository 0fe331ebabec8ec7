package com.gotable.payment.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 결제 제공자의 PaymentIntent 객체 중 이 서비스가 읽는 필드.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentIntent(
        String id,
        String clientSecret,
        String status,
        Long amount,
        String currency,
        String latestCharge
) {

    public static final String STATUS_SUCCEEDED = "succeeded";

    public boolean isSucceeded() {
        return STATUS_SUCCEEDED.equals(status);
    }

    public boolean hasCharge() {
        return latestCharge != null && !latestCharge.isBlank();
    }
}
