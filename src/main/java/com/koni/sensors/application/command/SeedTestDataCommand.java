package com.koni.sensors.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to fill the store with back-dated generated readings.
 */
@Getter
@AllArgsConstructor
public class SeedTestDataCommand {

    /**
     * How many hours of history to generate (1-168).
     */
    private final int hours;

    /**
     * Minutes between two generated readings (1-60).
     */
    private final int intervalMinutes;
}
