package com.koni.sensors.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Result of generating one random reading; {@code data} echoes the generated values.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RandomDataResponse {

    private String status;
    private String message;
    private String id;
    private SensorDataResponse data;
}
