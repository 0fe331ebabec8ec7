package com.gotable.common.config;

import com.gotable.notification.SlackProperties;
import com.gotable.payment.gateway.StripeProperties;
import feign.Request;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 외부 HTTP 클라이언트(Stripe, Slack 웹훅) 공통 설정.
 *
 * <p>모든 호출이 요청 스레드를 블로킹하므로 연결/읽기 타임아웃을 짧게 둔다.
 * 재시도는 설정하지 않는다.</p>
 */
@Configuration
@EnableFeignClients(basePackages = "com.gotable")
@EnableConfigurationProperties({StripeProperties.class, SlackProperties.class})
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,
                10, TimeUnit.SECONDS,
                true
        );
    }
}
