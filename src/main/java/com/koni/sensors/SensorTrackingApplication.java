package com.koni.sensors;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Embedded statistics tracking service: receives sensor readings from the board over HTTP,
 * stores them in MongoDB and serves them back newest first.
 *
 * Spring Boot's Mongo auto-configuration is excluded; the MongoConnectionManager owns the only client.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class SensorTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensorTrackingApplication.class, args);
    }
}
