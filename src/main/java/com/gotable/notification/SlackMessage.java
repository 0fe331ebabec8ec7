package com.gotable.notification;

import java.util.List;
import java.util.Map;

/**
 * Incoming Webhook 페이로드.
 * Block Kit을 렌더링하지 못하는 클라이언트용 {@code text}와 {@code blocks}를 함께 보낸다.
 */
public record SlackMessage(String text, List<Map<String, Object>> blocks) {}
