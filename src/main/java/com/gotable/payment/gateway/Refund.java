package com.gotable.payment.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** 결제 제공자의 Refund 객체 중 응답에 쓰는 필드 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Refund(String id, Long amount, String status, String charge) {}
