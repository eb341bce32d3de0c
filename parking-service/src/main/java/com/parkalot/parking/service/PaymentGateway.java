package com.parkalot.parking.service;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Payment provider client.
 * Implementations: MockPaymentGateway (no keys configured), StripePaymentGateway (production).
 * Provider failures are returned as unsuccessful results, never thrown.
 */
public interface PaymentGateway {

    IntentResult createIntent(IntentRequest request);

    /**
     * Intent whose funds are transferred to the owner's connected account,
     * keeping {@code platformFee} as the application fee.
     */
    IntentResult createConnectIntent(IntentRequest request, String destinationAccountId, BigDecimal platformFee);

    IntentStatus getIntent(String intentId);

    /**
     * @param amount amount to refund, full refund when null
     * @param reason provider refund reason, {@code requested_by_customer} when null
     */
    RefundResult refund(String intentId, BigDecimal amount, String reason);

    boolean isTestMode();

    record IntentRequest(BigDecimal amount, String description, String customerId, Map<String, String> metadata) {
    }

    record IntentResult(boolean success, String intentId, String clientSecret, BigDecimal amount,
                        String currency, String status, boolean testMode, String errorMessage) {

        public static IntentResult failure(String errorMessage) {
            return new IntentResult(false, null, null, null, null, null, false, errorMessage);
        }
    }

    record IntentStatus(boolean success, String intentId, String status, BigDecimal amount,
                        String currency, String errorMessage) {

        public static final String SUCCEEDED = "succeeded";

        public boolean isSucceeded() {
            return success && SUCCEEDED.equals(status);
        }

        public static IntentStatus failure(String intentId, String errorMessage) {
            return new IntentStatus(false, intentId, null, null, null, errorMessage);
        }
    }

    record RefundResult(boolean success, String refundId, BigDecimal amount, String status, String errorMessage) {

        public static RefundResult success(String refundId, BigDecimal amount, String status) {
            return new RefundResult(true, refundId, amount, status, null);
        }

        public static RefundResult failure(String errorMessage) {
            return new RefundResult(false, null, null, null, errorMessage);
        }
    }
}
