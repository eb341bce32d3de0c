package com.parkalot.parking.service;

import com.parkalot.parking.config.PaymentProperties;
import com.stripe.param.RefundCreateParams;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class StripePaymentGatewayTest {

    @Test
    void toMinorUnits_roundsHalfUp() {
        assertThat(StripePaymentGateway.toMinorUnits(new BigDecimal("17.25"))).isEqualTo(1725L);
        assertThat(StripePaymentGateway.toMinorUnits(new BigDecimal("0.005"))).isEqualTo(1L);
        assertThat(StripePaymentGateway.toMinorUnits(new BigDecimal("3"))).isEqualTo(300L);
    }

    @Test
    void fromMinorUnits_scalesToPounds() {
        assertThat(StripePaymentGateway.fromMinorUnits(1725L)).isEqualByComparingTo("17.25");
        assertThat(StripePaymentGateway.fromMinorUnits(null)).isNull();
    }

    @Test
    void refundReason_knownValue_mapped() {
        assertThat(StripePaymentGateway.refundReason("duplicate")).isEqualTo(RefundCreateParams.Reason.DUPLICATE);
    }

    @Test
    void refundReason_unknownOrMissing_defaultsToCustomerRequest() {
        assertThat(StripePaymentGateway.refundReason("changed my mind"))
                .isEqualTo(RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER);
        assertThat(StripePaymentGateway.refundReason(null))
                .isEqualTo(RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER);
    }

    @Test
    void isTestMode_followsKeyPrefix() {
        PaymentProperties properties = new PaymentProperties();
        properties.setSecretKey("sk_test_123");
        assertThat(new StripePaymentGateway(properties).isTestMode()).isTrue();

        properties.setSecretKey("sk_live_123");
        assertThat(new StripePaymentGateway(properties).isTestMode()).isFalse();
    }
}
