package com.parkalot.parking.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.domain.BookingType;
import com.parkalot.parking.service.BookingPaymentUpdater.BookingRef;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider event envelope: {@code {id, type, data: {object: {...}}}}.
 */
public record WebhookEvent(String id, String type, JsonNode dataObject) {

    public static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String PAYMENT_FAILED = "payment_intent.payment_failed";
    public static final String CHARGE_REFUNDED = "charge.refunded";

    private static final String UNKNOWN_FAILURE = "Unknown error";

    public static WebhookEvent parse(ObjectMapper objectMapper, String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Malformed webhook payload");
        }
        if (root == null || !root.isObject()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Malformed webhook payload");
        }
        return new WebhookEvent(
                textOrNull(root.path("id")),
                root.path("type").asText(""),
                root.path("data").path("object"));
    }

    /**
     * Intent the event is about. Charge events reference it through {@code payment_intent}.
     */
    public String intentId() {
        if (CHARGE_REFUNDED.equals(type)) {
            return textOrNull(dataObject.path("payment_intent"));
        }
        return textOrNull(dataObject.path("id"));
    }

    public Map<String, String> metadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        dataObject.path("metadata").fields()
                .forEachRemaining(entry -> metadata.put(entry.getKey(), entry.getValue().asText()));
        return metadata;
    }

    /**
     * Booking named in the metadata, or null when absent or unrecognised.
     */
    public BookingRef bookingRef() {
        Map<String, String> metadata = metadata();
        String type = metadata.get("booking_type");
        String bookingId = metadata.get("booking_id");
        if (type == null || bookingId == null) {
            return null;
        }
        try {
            return new BookingRef(BookingType.from(type), Long.valueOf(bookingId));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String failureMessage() {
        String message = textOrNull(dataObject.path("last_payment_error").path("message"));
        return message != null ? message : UNKNOWN_FAILURE;
    }

    /**
     * Cumulative refunded amount in major units, or null when not reported.
     */
    public BigDecimal amountRefunded() {
        JsonNode amount = dataObject.path("amount_refunded");
        return amount.canConvertToLong() ? BigDecimal.valueOf(amount.asLong(), 2) : null;
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() || node.asText().isEmpty() ? null : node.asText();
    }
}
