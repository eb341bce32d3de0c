package com.parkalot.parking.dto.response;

public record PaymentConfigResponse(String publishableKey, String currency, boolean testMode) {
}
