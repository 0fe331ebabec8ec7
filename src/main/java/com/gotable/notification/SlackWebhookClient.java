package com.gotable.notification;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.net.URI;

/**
 * Slack Incoming Webhook 클라이언트.
 * 웹훅 URL은 호출마다 넘기므로, URL이 비어 있어도 기동 시 클라이언트 생성은 실패하지 않는다.
 */
@FeignClient(name = "slackWebhook", url = "https://hooks.slack.com")
public interface SlackWebhookClient {

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    void send(URI webhookUrl, @RequestBody SlackMessage message);
}
