package com.koni.sensors.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SeedResponse {

    private String status;
    private String message;

    @JsonProperty("records_inserted")
    private int recordsInserted;

    private int hours;

    @JsonProperty("interval_minutes")
    private int intervalMinutes;
}
