package com.parkalot.parking.controller;

import com.parkalot.common.response.ApiResponse;
import com.parkalot.parking.dto.request.ConfirmPaymentRequest;
import com.parkalot.parking.dto.request.CreatePaymentIntentRequest;
import com.parkalot.parking.dto.request.CreateSpacePaymentRequest;
import com.parkalot.parking.dto.request.RefundRequest;
import com.parkalot.parking.dto.response.ConfirmPaymentResponse;
import com.parkalot.parking.dto.response.PaymentConfigResponse;
import com.parkalot.parking.dto.response.PaymentHistoryResponse;
import com.parkalot.parking.dto.response.PaymentIntentResponse;
import com.parkalot.parking.dto.response.RefundResponse;
import com.parkalot.parking.jooq.PaymentJooqRepository.PaymentStats;
import com.parkalot.parking.service.PaymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Payment", description = "Payment intents, confirmation and refunds")
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @Operation(summary = "Public payment config", description = "Publishable key and currency for the client")
    @GetMapping("/config")
    public ResponseEntity<ApiResponse<PaymentConfigResponse>> getConfig() {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.getConfig()));
    }

    @Operation(summary = "Create payment intent", description = "For garage, customer_space or airport bookings")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Intent created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Payment provider error")
    })
    @PostMapping("/intents")
    public ResponseEntity<ApiResponse<PaymentIntentResponse>> createIntent(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody CreatePaymentIntentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(paymentService.createIntent(userId, request)));
    }

    @Operation(summary = "Pay for a space booking", description = "Amount is taken from the booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Intent created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Not the renter"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking already paid"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Payment provider error")
    })
    @PostMapping("/space")
    public ResponseEntity<ApiResponse<PaymentIntentResponse>> createSpacePayment(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody CreateSpacePaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(paymentService.createSpacePayment(userId, request.bookingId())));
    }

    @Operation(summary = "Confirm payment", description = "Re-check the intent with the provider after client confirmation")
    @PostMapping("/confirm")
    public ResponseEntity<ApiResponse<ConfirmPaymentResponse>> confirmPayment(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody ConfirmPaymentRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.confirmPayment(userId, request.paymentIntentId())));
    }

    @Operation(summary = "Refund payment", description = "Full refund when no amount is given")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Refund issued"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Payment not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Already refunded"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Refund failed at provider")
    })
    @PostMapping("/refunds")
    public ResponseEntity<ApiResponse<RefundResponse>> refund(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody RefundRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.refund(userId, request)));
    }

    @Operation(summary = "Payment history")
    @GetMapping("/history")
    public ResponseEntity<ApiResponse<PaymentHistoryResponse>> getHistory(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.getHistory(userId, page, size)));
    }

    @Operation(summary = "Payment stats")
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<PaymentStats>> getStats(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(paymentService.getStats(userId)));
    }
}
