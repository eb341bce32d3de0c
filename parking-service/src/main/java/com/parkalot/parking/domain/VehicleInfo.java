package com.parkalot.parking.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class VehicleInfo {

    @Column(name = "vehicle_reg", length = 20)
    private String registration;

    @Column(name = "vehicle_make", length = 100)
    private String make;

    @Column(name = "vehicle_model", length = 100)
    private String model;

    @Column(name = "vehicle_color", length = 50)
    private String color;
}
