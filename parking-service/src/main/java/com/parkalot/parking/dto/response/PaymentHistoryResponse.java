package com.parkalot.parking.dto.response;

import com.parkalot.parking.jooq.PaymentJooqRepository.PaymentStats;

import java.util.List;

public record PaymentHistoryResponse(List<PaymentResponse> payments, PaymentStats stats, int count) {
}
