package com.parkalot.parking.config;

import com.parkalot.parking.service.MockPaymentGateway;
import com.parkalot.parking.service.PaymentGateway;
import com.parkalot.parking.service.StripePaymentGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class PaymentGatewayConfig {

    @Bean
    public PaymentGateway paymentGateway(PaymentProperties properties) {
        if (properties.isMockMode()) {
            log.warn("No payment secret key configured, using mock payment gateway");
            return new MockPaymentGateway(properties.getCurrency());
        }
        return new StripePaymentGateway(properties);
    }
}
