package com.parkalot.parking.controller;

import com.parkalot.common.response.ApiResponse;
import com.parkalot.common.response.ApiResponse.PageInfo;
import com.parkalot.parking.domain.SpaceType;
import com.parkalot.parking.dto.request.CreateSpaceRequest;
import com.parkalot.parking.dto.request.UpdateSpaceRequest;
import com.parkalot.parking.dto.response.SpaceResponse;
import com.parkalot.parking.jooq.SpaceJooqRepository.OwnerEarnings;
import com.parkalot.parking.jooq.SpaceJooqRepository.PeriodEarnings;
import com.parkalot.parking.jooq.SpaceJooqRepository.SpaceEarnings;
import com.parkalot.parking.jooq.SpaceSearchCriteria;
import com.parkalot.parking.service.SpaceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@Tag(name = "Space", description = "Customer parking space listings and owner earnings")
@RestController
@RequestMapping("/api/v1/spaces")
@RequiredArgsConstructor
public class SpaceController {

    private final SpaceService spaceService;

    @Operation(summary = "Search spaces", description = "Active spaces by location, price, type and amenities")
    @GetMapping
    public ResponseEntity<ApiResponse<List<SpaceResponse>>> search(
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String postcode,
            @RequestParam(required = false) BigDecimal maxPrice,
            @RequestParam(required = false) SpaceType spaceType,
            @RequestParam(required = false) List<String> amenities,
            @RequestParam(required = false) Double latitude,
            @RequestParam(required = false) Double longitude,
            @RequestParam(required = false) Double radius,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        SpaceSearchCriteria criteria = SpaceSearchCriteria.builder()
                .city(city)
                .postcode(postcode)
                .maxPricePerHour(maxPrice)
                .spaceType(spaceType)
                .amenities(amenities)
                .latitude(latitude)
                .longitude(longitude)
                .radiusMiles(radius)
                .limit(limit)
                .offset(offset)
                .build();
        List<SpaceResponse> results = spaceService.search(criteria);
        return ResponseEntity.ok(ApiResponse.ok(results,
                new PageInfo(criteria.effectiveLimit(), criteria.effectiveOffset(), results.size())));
    }

    @Operation(summary = "Create space", description = "New listings start pending")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Space created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<SpaceResponse>> createSpace(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody CreateSpaceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(spaceService.createSpace(userId, request)));
    }

    @Operation(summary = "Get space")
    @GetMapping("/{spaceId}")
    public ResponseEntity<ApiResponse<SpaceResponse>> getSpace(@PathVariable Long spaceId) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.getSpace(spaceId)));
    }

    @Operation(summary = "Update space", description = "Owner only")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Space updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Not the owner"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Space not found")
    })
    @PutMapping("/{spaceId}")
    public ResponseEntity<ApiResponse<SpaceResponse>> updateSpace(
            @PathVariable Long spaceId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody UpdateSpaceRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.updateSpace(spaceId, userId, request)));
    }

    @Operation(summary = "Pause space")
    @PostMapping("/{spaceId}/pause")
    public ResponseEntity<ApiResponse<SpaceResponse>> pauseSpace(
            @PathVariable Long spaceId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.pauseSpace(spaceId, userId)));
    }

    @Operation(summary = "Resume space")
    @PostMapping("/{spaceId}/resume")
    public ResponseEntity<ApiResponse<SpaceResponse>> resumeSpace(
            @PathVariable Long spaceId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.resumeSpace(spaceId, userId)));
    }

    @Operation(summary = "Delete space", description = "Only spaces that were never booked can be deleted")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Space deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Not the owner"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Space has bookings")
    })
    @DeleteMapping("/{spaceId}")
    public ResponseEntity<ApiResponse<Void>> deleteSpace(
            @PathVariable Long spaceId,
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        spaceService.deleteSpace(spaceId, userId);
        return ResponseEntity.ok(ApiResponse.ok());
    }

    @Operation(summary = "List owner's spaces")
    @GetMapping("/mine")
    public ResponseEntity<ApiResponse<List<SpaceResponse>>> getOwnerSpaces(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.getOwnerSpaces(userId)));
    }

    @Operation(summary = "Owner earnings summary")
    @GetMapping("/earnings")
    public ResponseEntity<ApiResponse<OwnerEarnings>> getOwnerEarnings(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.getOwnerEarnings(userId)));
    }

    @Operation(summary = "Owner earnings per space")
    @GetMapping("/earnings/by-space")
    public ResponseEntity<ApiResponse<List<SpaceEarnings>>> getEarningsBySpace(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.getEarningsBySpace(userId)));
    }

    @Operation(summary = "Owner earnings by week, month or year")
    @GetMapping("/earnings/by-period")
    public ResponseEntity<ApiResponse<List<PeriodEarnings>>> getEarningsByPeriod(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam(defaultValue = "month") String period) {
        return ResponseEntity.ok(ApiResponse.ok(spaceService.getEarningsByPeriod(userId, period)));
    }
}
