package com.biomirror.orchestrator.sensor;

/**
 * Lifecycle of one sample producer. Producers push samples into the fusion engine
 * at their own cadence between {@link #start()} and {@link #stop()}.
 */
public interface SensorService {

    String name();

    void start() throws SensorUnavailableException;

    void stop();

    void pause();

    void resume();
}
