package com.parkalot.parking.service;

import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import com.parkalot.parking.domain.BookingStatus;
import com.parkalot.parking.domain.Space;
import com.parkalot.parking.dto.request.CreateSpaceRequest;
import com.parkalot.parking.dto.request.UpdateSpaceRequest;
import com.parkalot.parking.dto.response.SpaceResponse;
import com.parkalot.parking.jooq.SpaceJooqRepository;
import com.parkalot.parking.jooq.EarningsPeriod;
import com.parkalot.parking.jooq.SpaceJooqRepository.OwnerEarnings;
import com.parkalot.parking.jooq.SpaceJooqRepository.PeriodEarnings;
import com.parkalot.parking.jooq.SpaceJooqRepository.SpaceEarnings;
import com.parkalot.parking.jooq.SpaceJooqRepository.SpaceSearchHit;
import com.parkalot.parking.jooq.SpaceSearchCriteria;
import com.parkalot.parking.repository.BookingRepository;
import com.parkalot.parking.repository.SpaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SpaceService {

    private final SpaceRepository spaceRepository;
    private final SpaceJooqRepository spaceJooqRepository;
    private final BookingRepository bookingRepository;
    private final Clock clock;

    /**
     * New listings start pending until moderated.
     */
    @Transactional
    public SpaceResponse createSpace(Long ownerId, CreateSpaceRequest request) {
        if (request.pricePerHour() == null || request.pricePerHour().signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Price per hour must be greater than 0");
        }
        if (request.photos() != null && request.photos().size() > Space.MAX_PHOTOS) {
            throw new BusinessException(ErrorCode.TOO_MANY_PHOTOS);
        }

        Space space = Space.builder()
                .ownerId(ownerId)
                .spaceName(request.spaceName().trim())
                .description(request.description())
                .spaceType(request.spaceType())
                .addressLine1(request.addressLine1())
                .addressLine2(request.addressLine2())
                .city(request.city().trim())
                .postcode(request.postcode().trim().toUpperCase())
                .latitude(request.latitude())
                .longitude(request.longitude())
                .pricePerHour(request.pricePerHour())
                .pricePerDay(positiveOrNull(request.pricePerDay()))
                .minBookingHours(request.minBookingHours())
                .maxBookingDays(request.maxBookingDays())
                .amenities(request.amenities())
                .photos(request.photos())
                .accessInstructions(request.accessInstructions())
                .payoutAccountId(request.payoutAccountId())
                .build();

        space = spaceRepository.save(space);
        log.info("Space created: spaceId={}, ownerId={}, city={}", space.getId(), ownerId, space.getCity());
        return SpaceResponse.from(space);
    }

    @Transactional
    public SpaceResponse updateSpace(Long spaceId, Long ownerId, UpdateSpaceRequest request) {
        Space space = loadOwned(spaceId, ownerId);

        space.updateDetails(request.spaceName(), request.description(), request.spaceType(),
                request.accessInstructions());
        space.updateLocation(request.addressLine1(), request.addressLine2(), request.city(),
                request.postcode() != null ? request.postcode().trim().toUpperCase() : null,
                request.latitude(), request.longitude());
        space.updatePricing(request.pricePerHour(), request.pricePerDay(),
                request.minBookingHours(), request.maxBookingDays());
        if (request.amenities() != null) {
            space.replaceAmenities(request.amenities());
        }
        if (request.photos() != null) {
            space.replacePhotos(request.photos());
        }
        if (request.payoutAccountId() != null) {
            space.updatePayoutAccount(request.payoutAccountId().isBlank() ? null : request.payoutAccountId());
        }

        log.info("Space updated: spaceId={}, ownerId={}", spaceId, ownerId);
        return SpaceResponse.from(space);
    }

    @Transactional
    public SpaceResponse pauseSpace(Long spaceId, Long ownerId) {
        Space space = loadOwned(spaceId, ownerId);
        space.pause();
        log.info("Space paused: spaceId={}", spaceId);
        return SpaceResponse.from(space);
    }

    @Transactional
    public SpaceResponse resumeSpace(Long spaceId, Long ownerId) {
        Space space = loadOwned(spaceId, ownerId);
        space.resume();
        log.info("Space resumed: spaceId={}", spaceId);
        return SpaceResponse.from(space);
    }

    @Transactional(readOnly = true)
    public SpaceResponse getSpace(Long spaceId) {
        return SpaceResponse.from(load(spaceId));
    }

    @Transactional(readOnly = true)
    public List<SpaceResponse> getOwnerSpaces(Long ownerId) {
        return spaceRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(SpaceResponse::from)
                .toList();
    }

    /**
     * Active spaces matching the criteria, in search order.
     */
    @Transactional(readOnly = true)
    public List<SpaceResponse> search(SpaceSearchCriteria criteria) {
        List<SpaceSearchHit> hits = spaceJooqRepository.search(criteria);
        if (hits.isEmpty()) {
            return List.of();
        }
        Map<Long, Space> spaces = spaceRepository.findAllById(hits.stream().map(SpaceSearchHit::spaceId).toList())
                .stream()
                .collect(Collectors.toMap(Space::getId, Function.identity()));

        return hits.stream()
                .filter(hit -> spaces.containsKey(hit.spaceId()))
                .map(hit -> SpaceResponse.from(spaces.get(hit.spaceId()), roundDistance(hit.distanceMiles())))
                .toList();
    }

    /**
     * Month earnings cover the current UTC calendar month.
     */
    @Transactional(readOnly = true)
    public OwnerEarnings getOwnerEarnings(Long ownerId) {
        YearMonth month = YearMonth.now(clock);
        return spaceJooqRepository.getOwnerEarnings(ownerId, startOf(month), startOf(month.plusMonths(1)));
    }

    @Transactional(readOnly = true)
    public List<SpaceEarnings> getEarningsBySpace(Long ownerId) {
        YearMonth month = YearMonth.now(clock);
        return spaceJooqRepository.getEarningsBySpace(ownerId, startOf(month), startOf(month.plusMonths(1)));
    }

    @Transactional(readOnly = true)
    public List<PeriodEarnings> getEarningsByPeriod(Long ownerId, String period) {
        return spaceJooqRepository.getEarningsByPeriod(ownerId, EarningsPeriod.from(period));
    }

    /**
     * Spaces referenced by any booking are never removed; owners pause them instead.
     */
    @Transactional
    public void deleteSpace(Long spaceId, Long ownerId) {
        Space space = loadOwned(spaceId, ownerId);

        if (bookingRepository.countBySpaceIdAndBookingStatusIn(spaceId, BookingStatus.OCCUPYING) > 0) {
            throw new BusinessException(ErrorCode.SPACE_HAS_ACTIVE_BOOKINGS);
        }
        if (bookingRepository.existsBySpaceId(spaceId)) {
            throw new BusinessException(ErrorCode.SPACE_HAS_BOOKING_HISTORY);
        }

        spaceRepository.delete(space);
        log.info("Space deleted: spaceId={}, ownerId={}", spaceId, ownerId);
    }

    private Space load(Long spaceId) {
        return spaceRepository.findById(spaceId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SPACE_NOT_FOUND, "Space not found: " + spaceId));
    }

    private Space loadOwned(Long spaceId, Long ownerId) {
        Space space = load(spaceId);
        if (!space.isOwnedBy(ownerId)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Space belongs to another owner: " + spaceId);
        }
        return space;
    }

    private static LocalDateTime startOf(YearMonth month) {
        return month.atDay(1).atStartOfDay();
    }

    private static BigDecimal positiveOrNull(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : null;
    }

    private static BigDecimal roundDistance(BigDecimal distance) {
        return distance == null ? null : distance.setScale(2, RoundingMode.HALF_UP);
    }
}
