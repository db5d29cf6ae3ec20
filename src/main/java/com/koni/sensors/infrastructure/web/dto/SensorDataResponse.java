package com.koni.sensors.infrastructure.web.dto;

import com.koni.sensors.domain.model.SensorReading;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored reading returned to clients, with the store-assigned id and timestamp.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SensorDataResponse {

    private String id;
    private Instant timestamp;
    private double temperature;
    private double humidity;
    private long voc;
    private int light;
    private int sound;
    private AxisData accelerometer;
    private AxisData gyroscope;

    public static SensorDataResponse from(SensorReading reading) {
        return new SensorDataResponse(
                reading.getId(),
                reading.getTimestamp(),
                reading.getTemperature(),
                reading.getHumidity(),
                reading.getVoc(),
                reading.getLight(),
                reading.getSound(),
                AxisData.from(reading.getAccelerometer()),
                AxisData.from(reading.getGyroscope()));
    }
}
