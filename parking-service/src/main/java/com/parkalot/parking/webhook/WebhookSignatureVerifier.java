package com.parkalot.parking.webhook;

import com.parkalot.parking.config.PaymentProperties;
import com.parkalot.parking.webhook.WebhookSignatureException.Reason;
import com.stripe.net.Webhook;
import com.stripe.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies {@code Stripe-Signature} style headers: {@code t=<unix seconds>,v1=<hex hmac>[,v1=...]},
 * where each v1 is HMAC-SHA256 of {@code "<t>.<payload>"} keyed by the webhook secret.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String TIMESTAMP_KEY = "t";
    private static final String SIGNATURE_KEY = "v1";

    private final PaymentProperties paymentProperties;
    private final Clock clock;

    public void verify(String payload, String header) {
        verify(payload, header, paymentProperties.getWebhook().getSecret());
    }

    public void verify(String payload, String header, String secret) {
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret is not configured, rejecting delivery");
            throw new WebhookSignatureException(Reason.INVALID_SIGNATURE);
        }
        if (payload == null || header == null || header.isBlank()) {
            throw reject(Reason.INVALID_SIGNATURE, "missing payload or header");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : header.split(",")) {
            String[] pair = part.trim().split("=", 2);
            if (pair.length != 2) {
                continue;
            }
            if (TIMESTAMP_KEY.equals(pair[0])) {
                timestamp = parseTimestamp(pair[1]);
            } else if (SIGNATURE_KEY.equals(pair[0])) {
                signatures.add(pair[1]);
            }
        }
        if (timestamp == null || signatures.isEmpty()) {
            throw reject(Reason.INVALID_SIGNATURE, "no timestamp or v1 signature");
        }

        long age = Math.abs(clock.instant().getEpochSecond() - timestamp);
        if (age > paymentProperties.getWebhook().getTolerance().getSeconds()) {
            throw reject(Reason.EXPIRED, "timestamp outside tolerance, age=" + age + "s");
        }

        String expected = sign(timestamp + "." + payload, secret);
        for (String signature : signatures) {
            if (StringUtils.secureCompare(expected, signature)) {
                return;
            }
        }
        throw reject(Reason.INVALID_SIGNATURE, "signature mismatch");
    }

    static String sign(String signedPayload, String secret) {
        try {
            return Webhook.Util.computeHmacSha256(secret, signedPayload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private Long parseTimestamp(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Unparseable webhook timestamp: {}", value);
            return null;
        }
    }

    private WebhookSignatureException reject(Reason reason, String detail) {
        log.warn("Webhook rejected: reason={}, detail={}", reason, detail);
        return new WebhookSignatureException(reason);
    }
}
