package com.gotable.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 전 도메인 공통 에러 코드.
 *
 * <p>각 상수는 기계가 읽는 분류, HTTP 상태, 클라이언트에 내려갈 기본 메시지를 묶는다.
 * 응답의 {@code type} URI는 상수 이름을 소문자로 바꿔 만든다.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Storage operation failed"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // 인증
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),

    // 사용자
    DUPLICATE_EMAIL(HttpStatus.CONFLICT, "Email already exists"),

    // 메뉴
    UNKNOWN_MENU(HttpStatus.BAD_REQUEST, "Menu does not exist"),
    MENU_UNAVAILABLE(HttpStatus.BAD_REQUEST, "Menu is currently unavailable"),

    // 결제
    NO_ITEMS_SELECTED(HttpStatus.BAD_REQUEST, "No menu items selected"),
    NON_POSITIVE_TOTAL(HttpStatus.BAD_REQUEST, "Total amount must be greater than zero"),
    PAYMENT_INCOMPLETE(HttpStatus.BAD_REQUEST, "Payment has not been completed"),
    PAYMENT_NOT_SUCCEEDED(HttpStatus.BAD_REQUEST, "Payment has not succeeded"),
    PAYMENT_AMOUNT_MISMATCH(HttpStatus.BAD_REQUEST, "Paid amount does not match the selected menus"),
    PAYMENT_ALREADY_USED(HttpStatus.CONFLICT, "Payment is already attached to a reservation"),
    ALREADY_REFUNDED(HttpStatus.CONFLICT, "Payment already refunded"),
    GATEWAY_ERROR(HttpStatus.BAD_GATEWAY, "Payment gateway request failed"),
    GATEWAY_NOT_CONFIGURED(HttpStatus.INTERNAL_SERVER_ERROR, "Payment gateway is not configured"),

    // 예약
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "Reservation not found");

    private final HttpStatus status;
    private final String message;
}
