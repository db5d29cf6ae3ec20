package com.koni.sensors.application.query;

/**
 * Query to retrieve every stored sensor reading, newest first.
 *
 * This is an empty query object as it has no parameters.
 */
public class GetSensorReadingsQuery {
    // No parameters - returns all readings
}
