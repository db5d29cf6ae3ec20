package com.koni.sensors.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Three-axis sample from an inertial sensor (accelerometer or gyroscope).
 */
@Getter
@ToString
@EqualsAndHashCode
public class AxisReading {

    private final double x;
    private final double y;
    private final double z;

    public AxisReading(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }
}
