package com.koni.sensors.application.command;

import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.domain.repository.SensorReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Command handler for storing sensor readings.
 *
 * Responsibilities:
 * - Validate the reading against the board's value ranges
 * - Persist it through the repository
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordSensorReadingCommandHandler {

    private final SensorReadingRepository repository;

    /**
     * Handles the command by validating and persisting the reading.
     *
     * @param command the reading to store
     * @return the identifier assigned by the store
     * @throws com.koni.sensors.domain.exception.ValidationException if validation fails
     */
    public String handle(RecordSensorReadingCommand command) {
        SensorReading reading = SensorReading.builder()
                .temperature(command.getTemperature())
                .humidity(command.getHumidity())
                .voc(command.getVoc())
                .light(command.getLight())
                .sound(command.getSound())
                .accelerometer(command.getAccelerometer())
                .gyroscope(command.getGyroscope())
                .build();
        reading.validate();

        String id = repository.insert(reading);
        log.info("Sensor reading saved: id={}, temperature={}, humidity={}",
                id, reading.getTemperature(), reading.getHumidity());
        return id;
    }
}
