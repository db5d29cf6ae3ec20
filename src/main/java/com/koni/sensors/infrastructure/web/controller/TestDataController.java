package com.koni.sensors.infrastructure.web.controller;

import com.koni.sensors.application.command.GenerateRandomReadingCommandHandler;
import com.koni.sensors.application.command.SeedTestDataCommand;
import com.koni.sensors.application.command.SeedTestDataCommandHandler;
import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.infrastructure.web.dto.RandomDataResponse;
import com.koni.sensors.infrastructure.web.dto.SeedResponse;
import com.koni.sensors.infrastructure.web.dto.SensorDataResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller generating test data for development and demos.
 *
 * Endpoints:
 * - POST /api/generate_random_data: store one generated reading
 * - POST /api/seed_test_data?hours=24&interval_minutes=5: store generated history
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class TestDataController {

    private final GenerateRandomReadingCommandHandler randomHandler;
    private final SeedTestDataCommandHandler seedHandler;

    @PostMapping("/generate_random_data")
    public ResponseEntity<RandomDataResponse> generateRandomData() {
        SensorReading reading = randomHandler.handle();

        return ResponseEntity.ok(new RandomDataResponse(
                "success",
                "Random sensor data generated and stored successfully",
                reading.getId(),
                SensorDataResponse.from(reading)));
    }

    /**
     * Generates {@code hours * 60 / interval_minutes} readings ending now.
     *
     * @return 200 OK with the number of inserted records, 400 if parameters are out of range
     */
    @PostMapping("/seed_test_data")
    public ResponseEntity<SeedResponse> seedTestData(
            @RequestParam(name = "hours", defaultValue = "24") int hours,
            @RequestParam(name = "interval_minutes", defaultValue = "5") int intervalMinutes) {
        log.info("Seeding test data: hours={}, intervalMinutes={}", hours, intervalMinutes);

        int inserted = seedHandler.handle(new SeedTestDataCommand(hours, intervalMinutes));

        return ResponseEntity.ok(new SeedResponse(
                "success",
                "Generated and inserted " + inserted + " test records",
                inserted,
                hours,
                intervalMinutes));
    }
}
