package com.parkalot.parking.service;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulated payment provider for development and tests.
 * Intents always succeed with a generated {@code pi_mock_} id.
 */
@Slf4j
public class MockPaymentGateway implements PaymentGateway {

    private static final int ID_BYTES = 12;
    private static final String REQUIRES_PAYMENT_METHOD = "requires_payment_method";

    private final String currency;

    public MockPaymentGateway(String currency) {
        this.currency = currency;
    }

    @Override
    public IntentResult createIntent(IntentRequest request) {
        log.info("Mock payment intent: amount={}, metadata={}", request.amount(), request.metadata());

        String intentId = "pi_mock_" + randomHex();
        return new IntentResult(true, intentId, intentId + "_secret_mock", request.amount(),
                currency, REQUIRES_PAYMENT_METHOD, true, null);
    }

    @Override
    public IntentResult createConnectIntent(IntentRequest request, String destinationAccountId, BigDecimal platformFee) {
        log.info("Mock connect intent: destination={}, platformFee={}", destinationAccountId, platformFee);
        return createIntent(request);
    }

    @Override
    public IntentStatus getIntent(String intentId) {
        return new IntentStatus(true, intentId, IntentStatus.SUCCEEDED, null, currency, null);
    }

    @Override
    public RefundResult refund(String intentId, BigDecimal amount, String reason) {
        log.info("Mock refund: intentId={}, amount={}, reason={}", intentId, amount, reason);
        return RefundResult.success("re_mock_" + randomHex(), amount, "succeeded");
    }

    @Override
    public boolean isTestMode() {
        return true;
    }

    private static String randomHex() {
        byte[] bytes = new byte[ID_BYTES];
        ThreadLocalRandom.current().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
