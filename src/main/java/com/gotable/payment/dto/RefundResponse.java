package com.gotable.payment.dto;

import com.gotable.payment.gateway.Refund;

/** 환불 결과 (취소 응답과 직접 환불 응답에서 공용) */
public record RefundResponse(String refundId, Long amount, String status) {

    public static RefundResponse from(Refund refund) {
        return new RefundResponse(refund.id(), refund.amount(), refund.status());
    }
}
