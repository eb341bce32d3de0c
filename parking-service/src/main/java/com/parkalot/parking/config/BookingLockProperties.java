package com.parkalot.parking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "parkalot.booking.lock")
public class BookingLockProperties {

    private Duration waitTime = Duration.ofSeconds(3);
    private Duration leaseTime = Duration.ofSeconds(10);
}
