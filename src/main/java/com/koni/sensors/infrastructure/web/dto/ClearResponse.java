package com.koni.sensors.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ClearResponse {

    private String status;
    private String message;

    @JsonProperty("deleted_count")
    private long deletedCount;
}
