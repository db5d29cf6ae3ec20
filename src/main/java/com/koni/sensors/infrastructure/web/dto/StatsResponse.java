package com.koni.sensors.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.sensors.domain.model.StoreStats;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Descriptive snapshot of the reading collection.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {

    private String database;
    private String collection;

    @JsonProperty("document_count")
    private long documentCount;

    private boolean exists;

    @JsonProperty("size_bytes")
    private long sizeBytes;

    private List<String> indexes;

    public static StatsResponse from(StoreStats stats) {
        return new StatsResponse(
                stats.getDatabase(),
                stats.getCollection(),
                stats.getDocumentCount(),
                stats.isExists(),
                stats.getSizeBytes(),
                stats.getIndexes());
    }
}
