package com.parkalot.parking;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@OpenAPIDefinition(info = @Info(
        title = "ParkaLot Parking Service API",
        description = "Parking space listings, bookings with locked availability checks, payments and provider webhooks",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = {"com.parkalot.parking", "com.parkalot.common.exception"})
public class ParkingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ParkingServiceApplication.class, args);
    }
}
