package com.gotable.payment.gateway;

import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;

/**
 * {@link StripeApiClient} 전용 설정 (시크릿 키 Bearer 인터셉터).
 * 컴포넌트 스캔 대상이 되면 모든 Feign 클라이언트에 인터셉터가 붙으므로 {@code @Configuration}을 달지 않는다.
 */
public class StripeFeignConfig {

    @Bean
    public RequestInterceptor stripeAuthInterceptor(StripeProperties properties) {
        return template -> {
            if (properties.hasSecretKey()) {
                template.header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.secretKey());
            }
        };
    }
}
