package com.koni.sensors.infrastructure.web.controller;

import com.koni.sensors.application.command.ClearSensorReadingsCommand;
import com.koni.sensors.application.command.ClearSensorReadingsCommandHandler;
import com.koni.sensors.application.command.RecordSensorReadingCommand;
import com.koni.sensors.application.command.RecordSensorReadingCommandHandler;
import com.koni.sensors.application.query.GetSensorReadingsQuery;
import com.koni.sensors.application.query.GetSensorReadingsQueryHandler;
import com.koni.sensors.application.query.GetStoreStatsQuery;
import com.koni.sensors.application.query.GetStoreStatsQueryHandler;
import com.koni.sensors.infrastructure.web.dto.ClearResponse;
import com.koni.sensors.infrastructure.web.dto.InsertResponse;
import com.koni.sensors.infrastructure.web.dto.SensorDataRequest;
import com.koni.sensors.infrastructure.web.dto.SensorDataResponse;
import com.koni.sensors.infrastructure.web.dto.StatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for sensor readings.
 *
 * Endpoints:
 * - POST /api/send_data: store a reading sent by the embedded board
 * - GET /api/sensors_data: all readings, newest first
 * - DELETE /api/sensors_data: delete every reading
 * - GET /api/stats: collection statistics
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SensorController {

    private final RecordSensorReadingCommandHandler recordHandler;
    private final ClearSensorReadingsCommandHandler clearHandler;
    private final GetSensorReadingsQueryHandler readingsHandler;
    private final GetStoreStatsQueryHandler statsHandler;

    /**
     * Accepts a reading from the board. The JSON shape matches what the firmware sends;
     * the server adds the timestamp.
     *
     * @param request the reading to store
     * @return 200 OK with the identifier of the stored reading
     */
    @PostMapping("/send_data")
    public ResponseEntity<InsertResponse> sendData(@RequestBody @Valid SensorDataRequest request) {
        log.info("Received sensor data: temperature={}, humidity={}, voc={}",
                request.getTemperature(), request.getHumidity(), request.getVoc());

        RecordSensorReadingCommand command = new RecordSensorReadingCommand(
                request.getTemperature(),
                request.getHumidity(),
                request.getVoc(),
                request.getLight(),
                request.getSound(),
                request.getAccelerometer().toAxisReading(),
                request.getGyroscope().toAxisReading()
        );

        String id = recordHandler.handle(command);

        return ResponseEntity.ok(new InsertResponse("success", "Sensor data stored successfully", id));
    }

    /**
     * Returns every stored reading sorted by timestamp, newest first (empty list if none).
     */
    @GetMapping("/sensors_data")
    public ResponseEntity<List<SensorDataResponse>> getSensorsData() {
        List<SensorDataResponse> readings = readingsHandler.handle(new GetSensorReadingsQuery()).stream()
                .map(SensorDataResponse::from)
                .collect(Collectors.toList());

        log.info("Returning {} sensor readings", readings.size());
        return ResponseEntity.ok(readings);
    }

    @DeleteMapping("/sensors_data")
    public ResponseEntity<ClearResponse> clearSensorsData() {
        long deleted = clearHandler.handle(new ClearSensorReadingsCommand());
        return ResponseEntity.ok(new ClearResponse("success", "Deleted " + deleted + " sensor readings", deleted));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(StatsResponse.from(statsHandler.handle(new GetStoreStatsQuery())));
    }
}
