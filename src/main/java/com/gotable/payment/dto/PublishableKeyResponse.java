package com.gotable.payment.dto;

public record PublishableKeyResponse(String publishableKey) {}
