package com.gotable.payment.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code payment.stripe.*} 설정.
 * 키는 환경 변수에서 읽으며 로컬에서는 없을 수 있다. 이때 호출은 {@code GATEWAY_NOT_CONFIGURED}로 실패한다.
 */
@ConfigurationProperties(prefix = "payment.stripe")
public record StripeProperties(
        String secretKey,
        String publishableKey,
        String baseUrl,
        String currency
) {

    public StripeProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api.stripe.com";
        }
        if (currency == null || currency.isBlank()) {
            currency = "jpy";
        }
    }

    public boolean hasSecretKey() {
        return secretKey != null && !secretKey.isBlank();
    }

    public boolean hasPublishableKey() {
        return publishableKey != null && !publishableKey.isBlank();
    }
}
