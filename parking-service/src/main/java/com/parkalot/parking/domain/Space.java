package com.parkalot.parking.domain;

import com.parkalot.common.domain.BaseTimeEntity;
import com.parkalot.common.exception.BusinessException;
import com.parkalot.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Entity
@Table(name = "customer_spaces")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Space extends BaseTimeEntity {

    public static final int MAX_PHOTOS = 6;
    private static final int DEFAULT_MIN_BOOKING_HOURS = 1;
    private static final int DEFAULT_MAX_BOOKING_DAYS = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "space_id")
    private Long id;

    @Column(nullable = false)
    private Long ownerId;

    @Column(nullable = false, length = 200)
    private String spaceName;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Convert(converter = SpaceType.DbConverter.class)
    @Column(nullable = false, length = 20)
    private SpaceType spaceType;

    @Column(nullable = false)
    private String addressLine1;

    private String addressLine2;

    @Column(nullable = false, length = 100)
    private String city;

    @Column(nullable = false, length = 20)
    private String postcode;

    @Column(precision = 10, scale = 7)
    private BigDecimal latitude;

    @Column(precision = 10, scale = 7)
    private BigDecimal longitude;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerHour;

    @Column(precision = 10, scale = 2)
    private BigDecimal pricePerDay;

    @Column(nullable = false)
    private int minBookingHours;

    @Column(nullable = false)
    private int maxBookingDays;

    @ElementCollection
    @CollectionTable(name = "customer_space_amenities", joinColumns = @JoinColumn(name = "space_id"))
    @Column(name = "amenity", length = 50)
    private Set<String> amenities = new LinkedHashSet<>();

    @ElementCollection
    @CollectionTable(name = "customer_space_photos", joinColumns = @JoinColumn(name = "space_id"))
    @OrderColumn(name = "position")
    @Column(name = "url", length = 500)
    private List<String> photos = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String accessInstructions;

    @Column(length = 100)
    private String payoutAccountId;

    @Convert(converter = SpaceStatus.DbConverter.class)
    @Column(nullable = false, length = 20)
    private SpaceStatus status;

    // Stats are only changed by in-place SQL increments; entity flushes must not write them back.
    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal totalEarnings;

    @Column(nullable = false, updatable = false)
    private int totalBookings;

    @Column(precision = 3, scale = 2, updatable = false)
    private BigDecimal averageRating;

    @Builder
    private Space(Long ownerId, String spaceName, String description, SpaceType spaceType,
                  String addressLine1, String addressLine2, String city, String postcode,
                  BigDecimal latitude, BigDecimal longitude,
                  BigDecimal pricePerHour, BigDecimal pricePerDay,
                  Integer minBookingHours, Integer maxBookingDays,
                  Collection<String> amenities, List<String> photos,
                  String accessInstructions, String payoutAccountId) {
        this.ownerId = ownerId;
        this.spaceName = spaceName;
        this.description = description;
        this.spaceType = spaceType != null ? spaceType : SpaceType.DRIVEWAY;
        this.addressLine1 = addressLine1;
        this.addressLine2 = addressLine2;
        this.city = city;
        this.postcode = postcode;
        this.latitude = latitude;
        this.longitude = longitude;
        this.pricePerHour = pricePerHour;
        this.pricePerDay = pricePerDay;
        this.minBookingHours = minBookingHours != null ? minBookingHours : DEFAULT_MIN_BOOKING_HOURS;
        this.maxBookingDays = maxBookingDays != null ? maxBookingDays : DEFAULT_MAX_BOOKING_DAYS;
        this.accessInstructions = accessInstructions;
        this.payoutAccountId = payoutAccountId;
        this.status = SpaceStatus.PENDING;
        this.totalEarnings = BigDecimal.ZERO;
        this.totalBookings = 0;
        this.averageRating = BigDecimal.ZERO;
        replaceAmenities(amenities);
        replacePhotos(photos);
    }

    public boolean isOwnedBy(Long userId) {
        return Objects.equals(ownerId, userId);
    }

    public boolean isActive() {
        return status == SpaceStatus.ACTIVE;
    }

    public boolean hasPayoutAccount() {
        return payoutAccountId != null && !payoutAccountId.isBlank();
    }

    public void updateDetails(String spaceName, String description, SpaceType spaceType,
                              String accessInstructions) {
        if (spaceName != null) {
            this.spaceName = spaceName;
        }
        if (description != null) {
            this.description = description;
        }
        if (spaceType != null) {
            this.spaceType = spaceType;
        }
        if (accessInstructions != null) {
            this.accessInstructions = accessInstructions;
        }
    }

    public void updateLocation(String addressLine1, String addressLine2, String city, String postcode,
                               BigDecimal latitude, BigDecimal longitude) {
        if (addressLine1 != null) {
            this.addressLine1 = addressLine1;
        }
        if (addressLine2 != null) {
            this.addressLine2 = addressLine2;
        }
        if (city != null) {
            this.city = city;
        }
        if (postcode != null) {
            this.postcode = postcode;
        }
        if (latitude != null && longitude != null) {
            this.latitude = latitude;
            this.longitude = longitude;
        }
    }

    public void updatePricing(BigDecimal pricePerHour, BigDecimal pricePerDay,
                              Integer minBookingHours, Integer maxBookingDays) {
        if (pricePerHour != null) {
            if (pricePerHour.signum() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Price per hour must be greater than 0");
            }
            this.pricePerHour = pricePerHour;
        }
        if (pricePerDay != null) {
            this.pricePerDay = pricePerDay.signum() > 0 ? pricePerDay : null;
        }
        if (minBookingHours != null) {
            this.minBookingHours = minBookingHours;
        }
        if (maxBookingDays != null) {
            this.maxBookingDays = maxBookingDays;
        }
    }

    public void updatePayoutAccount(String payoutAccountId) {
        this.payoutAccountId = payoutAccountId;
    }

    public void replaceAmenities(Collection<String> amenities) {
        this.amenities.clear();
        if (amenities != null) {
            amenities.stream()
                    .filter(a -> a != null && !a.isBlank())
                    .map(String::trim)
                    .forEach(this.amenities::add);
        }
    }

    public void replacePhotos(List<String> photos) {
        if (photos != null && photos.size() > MAX_PHOTOS) {
            throw new BusinessException(ErrorCode.TOO_MANY_PHOTOS);
        }
        this.photos.clear();
        if (photos != null) {
            this.photos.addAll(photos);
        }
    }

    public void pause() {
        if (status != SpaceStatus.ACTIVE) {
            throw new BusinessException(ErrorCode.INVALID_SPACE_STATUS,
                    "Only active spaces can be paused: current status=" + status.getCode());
        }
        this.status = SpaceStatus.PAUSED;
    }

    public void resume() {
        if (status != SpaceStatus.PAUSED) {
            throw new BusinessException(ErrorCode.INVALID_SPACE_STATUS,
                    "Only paused spaces can be resumed: current status=" + status.getCode());
        }
        this.status = SpaceStatus.ACTIVE;
    }
}
