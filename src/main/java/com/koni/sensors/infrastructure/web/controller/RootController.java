package com.koni.sensors.infrastructure.web.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service banner listing the public endpoints.
 */
@RestController
public class RootController {

    private final String version;

    public RootController(@Value("${sensors.api.version:1.0.0}") String version) {
        this.version = version;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /api/send_data", "Receive sensor data from embedded system");
        endpoints.put("GET /api/sensors_data", "Get all sensor data");
        endpoints.put("DELETE /api/sensors_data", "Delete all sensor data");
        endpoints.put("GET /api/stats", "Collection statistics");
        endpoints.put("POST /api/generate_random_data", "Generate one random reading (for development)");
        endpoints.put("POST /api/seed_test_data", "Generate test data (for development)");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Embedded Statistics Tracking API");
        body.put("version", version);
        body.put("endpoints", endpoints);
        return body;
    }
}
