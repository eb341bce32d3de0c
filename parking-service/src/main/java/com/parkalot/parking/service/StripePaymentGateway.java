package com.parkalot.parking.service;

import com.parkalot.parking.config.PaymentProperties;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stripe client. Amounts are sent in minor units (pence).
 */
@Slf4j
public class StripePaymentGateway implements PaymentGateway {

    private static final int STATEMENT_DESCRIPTOR_MAX = 22;
    private static final BigDecimal MINOR_UNITS = BigDecimal.valueOf(100);

    private final PaymentProperties properties;
    private final RequestOptions requestOptions;

    public StripePaymentGateway(PaymentProperties properties) {
        this.properties = properties;
        int timeoutMillis = (int) properties.getTimeout().toMillis();
        this.requestOptions = RequestOptions.builder()
                .setApiKey(properties.getSecretKey())
                .setConnectTimeout(timeoutMillis)
                .setReadTimeout(timeoutMillis)
                .build();
    }

    @Override
    public IntentResult createIntent(IntentRequest request) {
        return create(baseParams(request).build());
    }

    @Override
    public IntentResult createConnectIntent(IntentRequest request, String destinationAccountId, BigDecimal platformFee) {
        PaymentIntentCreateParams params = baseParams(request)
                .setApplicationFeeAmount(toMinorUnits(platformFee))
                .setTransferData(PaymentIntentCreateParams.TransferData.builder()
                        .setDestination(destinationAccountId)
                        .build())
                .putMetadata("platform_fee", platformFee.toPlainString())
                .build();
        return create(params);
    }

    @Override
    public IntentStatus getIntent(String intentId) {
        try {
            PaymentIntent intent = PaymentIntent.retrieve(intentId, requestOptions);
            return new IntentStatus(true, intent.getId(), intent.getStatus(),
                    fromMinorUnits(intent.getAmount()), intent.getCurrency(), null);
        } catch (StripeException e) {
            log.warn("Stripe intent lookup failed: intentId={}, error={}", intentId, e.getMessage());
            return IntentStatus.failure(intentId, e.getMessage());
        }
    }

    @Override
    public RefundResult refund(String intentId, BigDecimal amount, String reason) {
        RefundCreateParams.Builder params = RefundCreateParams.builder()
                .setPaymentIntent(intentId)
                .setReason(refundReason(reason));
        if (amount != null) {
            params.setAmount(toMinorUnits(amount));
        }
        try {
            Refund refund = Refund.create(params.build(), requestOptions);
            log.info("Stripe refund created: intentId={}, refundId={}", intentId, refund.getId());
            return RefundResult.success(refund.getId(), fromMinorUnits(refund.getAmount()), refund.getStatus());
        } catch (StripeException e) {
            log.warn("Stripe refund failed: intentId={}, error={}", intentId, e.getMessage());
            return RefundResult.failure(e.getMessage());
        }
    }

    @Override
    public boolean isTestMode() {
        return properties.getSecretKey().startsWith("sk_test_");
    }

    private PaymentIntentCreateParams.Builder baseParams(IntentRequest request) {
        PaymentIntentCreateParams.Builder builder = PaymentIntentCreateParams.builder()
                .setAmount(toMinorUnits(request.amount()))
                .setCurrency(properties.getCurrency())
                .setAutomaticPaymentMethods(PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                        .setEnabled(true)
                        .build())
                .setStatementDescriptor(statementDescriptor())
                .putMetadata("source", "parkalot");
        if (request.metadata() != null) {
            builder.putAllMetadata(request.metadata());
        }
        if (request.customerId() != null) {
            builder.setCustomer(request.customerId());
        }
        if (request.description() != null) {
            builder.setDescription(request.description());
        }
        return builder;
    }

    private IntentResult create(PaymentIntentCreateParams params) {
        try {
            PaymentIntent intent = PaymentIntent.create(params, requestOptions);
            log.info("Stripe intent created: intentId={}, status={}", intent.getId(), intent.getStatus());
            return new IntentResult(true, intent.getId(), intent.getClientSecret(),
                    fromMinorUnits(intent.getAmount()), intent.getCurrency(), intent.getStatus(),
                    isTestMode(), null);
        } catch (StripeException e) {
            log.warn("Stripe intent creation failed: code={}, error={}", e.getCode(), e.getMessage());
            return IntentResult.failure(e.getMessage());
        }
    }

    private String statementDescriptor() {
        String descriptor = properties.getStatementDescriptor();
        return descriptor.length() > STATEMENT_DESCRIPTOR_MAX
                ? descriptor.substring(0, STATEMENT_DESCRIPTOR_MAX)
                : descriptor;
    }

    static RefundCreateParams.Reason refundReason(String reason) {
        if (reason != null) {
            for (RefundCreateParams.Reason candidate : RefundCreateParams.Reason.values()) {
                if (candidate.getValue().equals(reason)) {
                    return candidate;
                }
            }
        }
        return RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER;
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.multiply(MINOR_UNITS).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    static BigDecimal fromMinorUnits(Long minorUnits) {
        return minorUnits != null ? BigDecimal.valueOf(minorUnits, 2) : null;
    }
}
