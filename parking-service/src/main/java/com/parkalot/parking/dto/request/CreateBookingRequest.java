package com.parkalot.parking.dto.request;

import com.parkalot.parking.domain.VehicleInfo;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

public record CreateBookingRequest(
        @NotNull Long spaceId,
        @NotNull LocalDateTime startTime,
        @NotNull LocalDateTime endTime,
        @Size(max = 20) String vehicleReg,
        @Size(max = 100) String vehicleMake,
        @Size(max = 100) String vehicleModel,
        @Size(max = 50) String vehicleColor,
        @Size(max = 2000) String renterNotes
) {

    public VehicleInfo vehicle() {
        if (vehicleReg == null && vehicleMake == null && vehicleModel == null && vehicleColor == null) {
            return null;
        }
        String registration = vehicleReg != null ? vehicleReg.trim().toUpperCase() : null;
        return new VehicleInfo(registration, vehicleMake, vehicleModel, vehicleColor);
    }
}
