package com.biomirror.orchestrator.sensor;

/**
 * Raised when a sensor cannot start, e.g. camera permission denied or wearable not paired.
 */
public class SensorUnavailableException extends Exception {

    private final String sensor;

    public SensorUnavailableException(String sensor, String message) {
        super(message);
        this.sensor = sensor;
    }

    public String getSensor() {
        return sensor;
    }
}
