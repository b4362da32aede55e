package com.biomirror.orchestrator.sensor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle handle for a sensor whose samples are produced by an external
 * collaborator (camera pipeline, wearable bridge). Start fails while the
 * collaborator has reported itself unavailable.
 */
public class CollaboratorSensorService implements SensorService {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorSensorService.class);

    public enum State { STOPPED, RUNNING, PAUSED }

    private final String name;
    private volatile boolean available = true;
    private volatile State state = State.STOPPED;

    public CollaboratorSensorService(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    /** Set by the collaborator, e.g. when a permission is revoked. */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public void start() throws SensorUnavailableException {
        if (!available) {
            throw new SensorUnavailableException(name, "sensor unavailable");
        }
        state = State.RUNNING;
        log.info("SENSOR_STARTED name={}", name);
    }

    @Override
    public void stop() {
        if (state == State.STOPPED) return;
        state = State.STOPPED;
        log.info("SENSOR_STOPPED name={}", name);
    }

    @Override
    public void pause() {
        if (state != State.RUNNING) return;
        state = State.PAUSED;
        log.debug("SENSOR_PAUSED name={}", name);
    }

    @Override
    public void resume() {
        if (state != State.PAUSED) return;
        state = State.RUNNING;
        log.debug("SENSOR_RESUMED name={}", name);
    }

    public State state() {
        return state;
    }
}
