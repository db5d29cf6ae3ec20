package com.koni.sensors.application.query;

/**
 * Query for a descriptive snapshot of the reading collection.
 */
public class GetStoreStatsQuery {
}
