package com.gotable.payment.dto;

/** 클라이언트가 결제를 확정할 때 쓰는 client secret과 서버가 계산한 금액 */
public record CreatePaymentIntentResponse(String clientSecret, String paymentIntentId, long amount) {}
