package com.parkalot.parking.controller;

import com.parkalot.common.response.ApiResponse;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.dto.request.CancelBookingRequest;
import com.parkalot.parking.dto.request.CreateBookingRequest;
import com.parkalot.parking.dto.request.UpdateBookingStatusRequest;
import com.parkalot.parking.dto.response.AvailabilityResponse;
import com.parkalot.parking.dto.response.BookedSlotResponse;
import com.parkalot.parking.dto.response.BookingResponse;
import com.parkalot.parking.dto.response.CancellationResponse;
import com.parkalot.parking.service.BookingService;
import com.parkalot.parking.service.PricingEngine.PriceQuote;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Tag(name = "Booking", description = "Space bookings, pricing and availability")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @Operation(summary = "Create booking", description = "Book a space (Redis lock + DB row lock on the space)")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Booking created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Space not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Space not active or already booked")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> createBooking(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody CreateBookingRequest request) {
        var booking = bookingService.createBooking(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Price quote", description = "Price for a space and time range, with the renter service fee")
    @GetMapping("/quote")
    public ResponseEntity<ApiResponse<PriceQuote>> quote(
            @RequestParam Long spaceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startTime,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endTime) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.calculatePrice(spaceId, startTime, endTime)));
    }

    @Operation(summary = "Check availability")
    @GetMapping("/availability")
    public ResponseEntity<ApiResponse<AvailabilityResponse>> checkAvailability(
            @RequestParam Long spaceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startTime,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endTime) {
        boolean available = bookingService.isAvailable(spaceId, startTime, endTime);
        return ResponseEntity.ok(ApiResponse.ok(new AvailabilityResponse(spaceId, startTime, endTime, available)));
    }

    @Operation(summary = "Get booking", description = "Visible to the renter and the space owner")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Not a participant"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found")
    })
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        var booking = bookingService.getBooking(bookingId, userId);
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Change booking status", description = "confirmed, active, completed, cancelled or disputed")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status changed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Not a participant"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Transition not allowed")
    })
    @PatchMapping("/{bookingId}/status")
    public ResponseEntity<ApiResponse<BookingResponse>> updateStatus(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody UpdateBookingStatusRequest request) {
        var booking = bookingService.updateStatus(bookingId, request.status(), userId, request.reason());
        return ResponseEntity.ok(ApiResponse.ok(BookingResponse.from(booking)));
    }

    @Operation(summary = "Cancel booking", description = "Cancel and refund by notice period: 24h full, 6h half")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking cancelled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Booking not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking already cancelled, completed or disputed")
    })
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<CancellationResponse>> cancelBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody(required = false) CancelBookingRequest request) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(ApiResponse.ok(bookingService.cancelBooking(bookingId, userId, reason)));
    }

    @Operation(summary = "List renter bookings")
    @GetMapping
    public ResponseEntity<ApiResponse<List<BookingResponse>>> getRenterBookings(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) BookingStatus status) {
        var bookings = bookingService.getRenterBookings(userId, status).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(bookings));
    }

    @Operation(summary = "List bookings on the owner's spaces")
    @GetMapping("/owner")
    public ResponseEntity<ApiResponse<List<BookingResponse>>> getOwnerBookings(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) BookingStatus status) {
        var bookings = bookingService.getOwnerBookings(userId, status).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(bookings));
    }

    @Operation(summary = "Space calendar", description = "Taken slots on a space from the given time (default now)")
    @GetMapping("/space/{spaceId}")
    public ResponseEntity<ApiResponse<List<BookedSlotResponse>>> getSpaceCalendar(
            @PathVariable Long spaceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.getSpaceCalendar(spaceId, from)));
    }

    @Operation(summary = "Upcoming booking count", description = "role=renter (default) or owner")
    @GetMapping("/upcoming/count")
    public ResponseEntity<ApiResponse<Map<String, Long>>> getUpcomingCount(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam(defaultValue = "renter") String role) {
        long count = bookingService.getUpcomingCount(userId, "owner".equalsIgnoreCase(role));
        return ResponseEntity.ok(ApiResponse.ok(Map.of("count", count)));
    }
}
