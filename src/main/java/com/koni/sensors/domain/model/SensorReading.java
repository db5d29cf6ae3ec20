package com.koni.sensors.domain.model;

import com.koni.sensors.domain.exception.ValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Sensor reading value object as reported by the embedded board.
 *
 * <p>{@code id} and {@code timestamp} are assigned by the store on insert and are
 * {@code null} on readings that have not been persisted yet.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class SensorReading {

    public static final int ADC_MAX = 4095;
    public static final long VOC_MAX = 4_294_967_295L;

    private final String id;
    private final Instant timestamp;
    private final double temperature;
    private final double humidity;
    private final long voc;
    private final int light;
    private final int sound;
    private final AxisReading accelerometer;
    private final AxisReading gyroscope;

    /**
     * Validates the reading against the ranges the board can produce.
     *
     * @throws ValidationException if validation fails
     */
    public void validate() {
        if (voc < 0 || voc > VOC_MAX) {
            throw new ValidationException("voc must be between 0 and " + VOC_MAX);
        }
        if (light < 0 || light > ADC_MAX) {
            throw new ValidationException("light must be between 0 and " + ADC_MAX);
        }
        if (sound < 0 || sound > ADC_MAX) {
            throw new ValidationException("sound must be between 0 and " + ADC_MAX);
        }
        if (accelerometer == null) {
            throw new ValidationException("accelerometer is required");
        }
        if (gyroscope == null) {
            throw new ValidationException("gyroscope is required");
        }
    }
}
