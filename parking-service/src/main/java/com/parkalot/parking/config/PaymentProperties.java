package com.parkalot.parking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "parkalot.payment")
public class PaymentProperties {

    private static final String DEMO_SECRET_KEY = "sk_test_demo_key";

    private String secretKey = "";
    private String publishableKey = "";
    private String currency = "gbp";
    private String statementDescriptor = "PARKALOT PARKING";
    private Duration timeout = Duration.ofSeconds(30);
    private Webhook webhook = new Webhook();

    @Getter
    @Setter
    public static class Webhook {
        private String secret = "";
        private Duration tolerance = Duration.ofSeconds(300);
    }

    /** Mock mode when no real secret key is configured */
    public boolean isMockMode() {
        return secretKey == null || secretKey.isBlank() || DEMO_SECRET_KEY.equals(secretKey);
    }
}
