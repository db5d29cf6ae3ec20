package com.koni.sensors.application.command;

import com.koni.sensors.application.service.SensorReadingGenerator;
import com.koni.sensors.domain.exception.ValidationException;
import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.domain.repository.SensorReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Command handler that seeds the store with generated history.
 *
 * Readings are spaced {@code intervalMinutes} apart and end at the current time,
 * oldest first, and are written in one bulk insert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeedTestDataCommandHandler {

    public static final int MAX_HOURS = 168;
    public static final int MAX_INTERVAL_MINUTES = 60;
    public static final int MAX_RECORDS = 10_000;

    private final SensorReadingGenerator generator;
    private final SensorReadingRepository repository;
    private final Clock clock;

    /**
     * @return number of readings inserted
     * @throws ValidationException if the parameters are out of range or would create too many records
     */
    public int handle(SeedTestDataCommand command) {
        validate(command);

        int records = (command.getHours() * 60) / command.getIntervalMinutes();
        if (records > MAX_RECORDS) {
            throw new ValidationException(
                    "Too many records requested (" + records + "). Maximum is " + MAX_RECORDS + ".");
        }

        Instant now = Instant.now(clock);
        Duration interval = Duration.ofMinutes(command.getIntervalMinutes());
        List<SensorReading> readings = new ArrayList<>(records);
        for (int i = 0; i < records; i++) {
            Instant timestamp = now.minus(interval.multipliedBy(records - i - 1L));
            readings.add(generator.generate().toBuilder().timestamp(timestamp).build());
        }

        int inserted = repository.insertAll(readings);
        log.info("Seeded {} test readings: hours={}, intervalMinutes={}",
                inserted, command.getHours(), command.getIntervalMinutes());
        return inserted;
    }

    private void validate(SeedTestDataCommand command) {
        if (command.getHours() < 1 || command.getHours() > MAX_HOURS) {
            throw new ValidationException("hours must be between 1 and " + MAX_HOURS);
        }
        if (command.getIntervalMinutes() < 1 || command.getIntervalMinutes() > MAX_INTERVAL_MINUTES) {
            throw new ValidationException("interval_minutes must be between 1 and " + MAX_INTERVAL_MINUTES);
        }
    }
}
