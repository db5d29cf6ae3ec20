package com.koni.sensors.application.command;

import com.koni.sensors.domain.model.AxisReading;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to store one reading sent by the embedded board.
 * The store assigns the identifier and timestamp.
 */
@Getter
@AllArgsConstructor
public class RecordSensorReadingCommand {

    private final double temperature;
    private final double humidity;
    private final long voc;
    private final int light;
    private final int sound;
    private final AxisReading accelerometer;
    private final AxisReading gyroscope;
}
