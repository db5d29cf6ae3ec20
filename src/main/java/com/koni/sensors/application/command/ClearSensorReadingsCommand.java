package com.koni.sensors.application.command;

/**
 * Command to delete every stored sensor reading.
 * Has no parameters.
 */
public class ClearSensorReadingsCommand {
}
