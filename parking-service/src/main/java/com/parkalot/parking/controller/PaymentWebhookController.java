package com.parkalot.parking.controller;

import com.parkalot.common.response.ApiResponse;
import com.parkalot.parking.webhook.WebhookReconciler;
import com.parkalot.parking.webhook.WebhookReconciler.WebhookResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Payment webhook", description = "Payment provider event delivery")
@RestController
@RequestMapping("/api/v1/payments/webhook")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private final WebhookReconciler webhookReconciler;

    @Operation(summary = "Receive provider event", description = "Body must be the raw signed payload")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Event received"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid webhook")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<WebhookResult>> receive(
            @RequestBody String payload,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature) {
        return ResponseEntity.ok(ApiResponse.ok(webhookReconciler.handle(payload, signature)));
    }
}
