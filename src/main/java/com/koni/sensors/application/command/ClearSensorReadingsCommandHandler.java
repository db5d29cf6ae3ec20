package com.koni.sensors.application.command;

import com.koni.sensors.domain.repository.SensorReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Command handler that clears the reading collection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClearSensorReadingsCommandHandler {

    private final SensorReadingRepository repository;

    /**
     * @return number of readings removed, zero if the store was already empty
     */
    public long handle(ClearSensorReadingsCommand command) {
        long deleted = repository.deleteAll();
        log.info("Cleared {} sensor readings", deleted);
        return deleted;
    }
}
