package com.koni.sensors.application.command;

import com.koni.sensors.application.service.SensorReadingGenerator;
import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.domain.repository.SensorReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates one realistic reading and stores it like a reading sent by the board.
 * Used for demos and manual testing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerateRandomReadingCommandHandler {

    private final SensorReadingGenerator generator;
    private final SensorReadingRepository repository;

    /**
     * @return the generated reading carrying the identifier assigned by the store
     */
    public SensorReading handle() {
        SensorReading reading = generator.generate();
        String id = repository.insert(reading);
        log.info("Random sensor reading stored: id={}", id);
        return reading.toBuilder().id(id).build();
    }
}
