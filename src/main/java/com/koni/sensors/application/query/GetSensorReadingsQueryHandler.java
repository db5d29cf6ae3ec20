package com.koni.sensors.application.query;

import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.domain.repository.SensorReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Query handler returning all readings ordered by timestamp, most recent first.
 * An empty store yields an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetSensorReadingsQueryHandler {

    private final SensorReadingRepository repository;

    public List<SensorReading> handle(GetSensorReadingsQuery query) {
        log.debug("Handling GetSensorReadingsQuery");

        List<SensorReading> readings = repository.findAllNewestFirst();

        log.info("Retrieved {} sensor readings", readings.size());
        return readings;
    }
}
