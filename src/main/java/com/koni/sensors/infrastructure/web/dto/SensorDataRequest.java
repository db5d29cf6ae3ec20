package com.koni.sensors.infrastructure.web.dto;

import com.koni.sensors.domain.model.SensorReading;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Reading as posted by the embedded board.
 *
 * Example:
 * {
 *   "temperature": 21.5, "humidity": 48.2, "voc": 120, "light": 1800, "sound": 300,
 *   "accelerometer": {"x": 0.01, "y": -0.02, "z": 9.81},
 *   "gyroscope": {"x": 0.0, "y": 0.01, "z": -0.01}
 * }
 *
 * All fields are required and validated using Jakarta Bean Validation annotations.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SensorDataRequest {

    @NotNull(message = "temperature is required")
    private Double temperature;

    @NotNull(message = "humidity is required")
    private Double humidity;

    @NotNull(message = "voc is required")
    @Min(value = 0, message = "voc must be >= 0")
    @Max(value = SensorReading.VOC_MAX, message = "voc must be <= " + SensorReading.VOC_MAX)
    private Long voc;

    @NotNull(message = "light is required")
    @Min(value = 0, message = "light must be >= 0")
    @Max(value = SensorReading.ADC_MAX, message = "light must be <= " + SensorReading.ADC_MAX)
    private Integer light;

    @NotNull(message = "sound is required")
    @Min(value = 0, message = "sound must be >= 0")
    @Max(value = SensorReading.ADC_MAX, message = "sound must be <= " + SensorReading.ADC_MAX)
    private Integer sound;

    @Valid
    @NotNull(message = "accelerometer is required")
    private AxisData accelerometer;

    @Valid
    @NotNull(message = "gyroscope is required")
    private AxisData gyroscope;
}
