package com.gotable.notification;

import com.gotable.reservation.entity.Reservation;
import com.gotable.reservation.entity.ReservationMenuItem;
import com.gotable.user.entity.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 예약 확정/취소 알림을 Slack 채널에 Block Kit 메시지로 보낸다.
 *
 * <p>{@code notification.slack}이 꺼져 있거나 웹훅 URL이 없으면 아무것도 하지 않는다.
 * 확정 알림에만 메뉴 목록이 들어간다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlackReservationNotifier implements ReservationNotifier {

    private static final DateTimeFormatter SCHEDULE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final SlackWebhookClient slackWebhookClient;
    private final SlackProperties properties;

    @Override
    public void reservationConfirmed(Reservation reservation) {
        send(buildMessage(reservation, "New reservation confirmed", true));
    }

    @Override
    public void reservationCancelled(Reservation reservation) {
        send(buildMessage(reservation, "Reservation cancelled", false));
    }

    SlackMessage buildMessage(Reservation reservation, String title, boolean includeMenus) {
        User user = reservation.getUser();
        String schedule = LocalDateTime.of(reservation.getReservationDate(), reservation.getReservationTime())
                .format(SCHEDULE_FORMAT);

        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(Map.of(
                "type", "header",
                "text", Map.of("type", "plain_text", "text", title)));
        blocks.add(Map.of(
                "type", "section",
                "fields", List.of(
                        field("Reservation", "#" + reservation.getId()),
                        field("Date", schedule),
                        field("Guest", user.getName()),
                        field("Party size", reservation.getNumberOfPeople() + " people"),
                        field("Email", user.getEmail()))));

        if (includeMenus && !reservation.getItems().isEmpty()) {
            blocks.add(section("*Menus:*\n" + formatMenus(reservation.getItems())));
        }
        if (reservation.getSpecialRequests() != null && !reservation.getSpecialRequests().isBlank()) {
            blocks.add(section("*Special requests:*\n" + reservation.getSpecialRequests()));
        }

        String text = String.format("%s: #%d %s, %s (%d people)",
                title, reservation.getId(), user.getName(), schedule, reservation.getNumberOfPeople());
        return new SlackMessage(text, blocks);
    }

    private void send(SlackMessage message) {
        if (!properties.isActive()) {
            log.debug("Slack notification skipped (disabled or no webhook URL)");
            return;
        }
        slackWebhookClient.send(URI.create(properties.webhookUrl()), message);
        log.info("Slack notification sent: {}", message.text());
    }

    private static String formatMenus(List<ReservationMenuItem> items) {
        return items.stream()
                .map(item -> String.format(Locale.ROOT, "- %s × %d (¥%,d)",
                        item.getMenu().getName(), item.getQuantity(), item.getSubtotal()))
                .collect(Collectors.joining("\n"));
    }

    private static Map<String, Object> field(String label, String value) {
        return Map.of("type", "mrkdwn", "text", "*" + label + ":*\n" + value);
    }

    private static Map<String, Object> section(String markdown) {
        return Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", markdown));
    }
}
