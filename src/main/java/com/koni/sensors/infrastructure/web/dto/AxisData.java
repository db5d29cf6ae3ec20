package com.koni.sensors.infrastructure.web.dto;

import com.koni.sensors.domain.model.AxisReading;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Three-axis values as exchanged with the board and the dashboard: {"x": .., "y": .., "z": ..}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AxisData {

    @NotNull(message = "x is required")
    private Double x;

    @NotNull(message = "y is required")
    private Double y;

    @NotNull(message = "z is required")
    private Double z;

    public static AxisData from(AxisReading axis) {
        return new AxisData(axis.getX(), axis.getY(), axis.getZ());
    }

    public AxisReading toAxisReading() {
        return new AxisReading(x, y, z);
    }
}
