package com.gotable.notification;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** {@code notification.slack.*} 설정. enabled이고 URL이 있을 때만 발송한다. */
@ConfigurationProperties(prefix = "notification.slack")
public record SlackProperties(boolean enabled, String webhookUrl) {

    public boolean isActive() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
