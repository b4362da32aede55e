package com.biomirror.orchestrator.config;

import com.biomirror.common.dissociation.DissociationTracker;
import com.biomirror.common.response.GroundingTechnique;
import com.biomirror.common.response.ResponseGenerator;
import com.biomirror.common.response.ResponsePreferences;
import com.biomirror.common.response.ResponseTriggerPolicy;
import com.biomirror.common.safety.SafetyMonitor;
import com.biomirror.common.safety.SafetyThresholds;
import com.biomirror.common.sink.SessionRecordSink;
import com.biomirror.orchestrator.feed.SessionFeeds;
import com.biomirror.orchestrator.fusion.StalenessPolicy;
import com.biomirror.orchestrator.fusion.StateFusionEngine;
import com.biomirror.orchestrator.history.StateHistory;
import com.biomirror.orchestrator.logger.SessionFlowLogger;
import com.biomirror.orchestrator.notification.LoggingSafetyNotificationPublisher;
import com.biomirror.orchestrator.notification.SafetyNotificationPublisher;
import com.biomirror.orchestrator.safety.SafetyProtocolDispatcher;
import com.biomirror.orchestrator.scheduler.ResponseScheduler;
import com.biomirror.orchestrator.sensor.CollaboratorSensorService;
import com.biomirror.orchestrator.sensor.SensorService;
import com.biomirror.orchestrator.session.SessionCoordinator;
import com.biomirror.orchestrator.sink.InMemorySessionRecordSink;
import com.biomirror.orchestrator.sink.JsonLoggingSessionRecordSink;
import com.biomirror.orchestrator.timer.SessionTimers;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Composition root. Builds every pipeline component explicitly and wires the
 * references; there is no ambient registry.
 */
@Configuration
public class SessionConfig {

    // ── fusion ──
    @Value("${biomirror.fusion.tick-interval:200ms}")
    private Duration fusionTickInterval;

    @Value("${biomirror.fusion.staleness-policy:HOLD_LAST}")
    private StalenessPolicy stalenessPolicy;

    // ── response ──
    @Value("${biomirror.response.sensitivity:0.7}")
    private double responseSensitivity;

    @Value("${biomirror.response.tick-interval:500ms}")
    private Duration responseTickInterval;

    @Value("${biomirror.response.max-queued:3}")
    private int maxQueuedResponses;

    @Value("${biomirror.response.random-seed:-1}")
    private long responseRandomSeed;

    @Value("${biomirror.response.mirroring-sensitivity:0.5}")
    private double mirroringSensitivity;

    @Value("${biomirror.response.grounding-techniques:BREATHING,SENSORY,MOVEMENT,COGNITIVE,NAMING}")
    private List<GroundingTechnique> groundingTechniques;

    // ── session ──
    @Value("${biomirror.session.default-duration:1200s}")
    private Duration defaultSessionDuration;

    @Value("${biomirror.session.auto-terminate-on-high-alert:true}")
    private boolean autoTerminateOnHighAlert;

    @Value("${biomirror.session.history-capacity:1000}")
    private int historyCapacity;

    // ── safety ──
    @Value("${biomirror.safety.distress-intensity:0.8}")
    private double distressIntensity;

    @Value("${biomirror.safety.distress-arousal:0.7}")
    private double distressArousal;

    @Value("${biomirror.safety.severe-dissociation:0.8}")
    private double severeDissociation;

    @Value("${biomirror.safety.extreme-arousal:0.9}")
    private double extremeArousal;

    @Value("${biomirror.safety.extreme-heart-rate:120}")
    private double extremeHeartRate;

    @Value("${biomirror.safety.sustained-arousal:0.9}")
    private double sustainedArousal;

    @Value("${biomirror.safety.intervention-after:120s}")
    private Duration interventionAfter;

    @Value("${biomirror.safety.termination-after:240s}")
    private Duration terminationAfter;

    @Value("${biomirror.safety.dissociation-termination-after:30s}")
    private Duration dissociationTerminationAfter;

    @Value("${biomirror.safety.guardian-notify-after:300s}")
    private Duration guardianNotifyAfter;

    @Value("${biomirror.safety.prolonged-negative-intensity:0.6}")
    private double prolongedNegativeIntensity;

    @Value("${biomirror.safety.prolonged-negative-after:60s}")
    private Duration prolongedNegativeAfter;

    @Value("${biomirror.safety.clear-readings-to-reset:10}")
    private int clearReadingsToReset;

    // ── notification ──
    @Value("${biomirror.notification.guardian-enabled:true}")
    private boolean guardianEnabled;

    @Value("${biomirror.notification.guardian-contact:}")
    private String guardianContact;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler sessionClock() {
        return Schedulers.newSingle("session-clock");
    }

    @Bean
    public SessionTimers sessionTimers(Scheduler sessionClock) {
        return new SessionTimers(sessionClock);
    }

    // ── domain ──

    @Bean
    public SafetyThresholds safetyThresholds() {
        return new SafetyThresholds(
            distressIntensity, distressArousal, severeDissociation,
            extremeArousal, extremeHeartRate, sustainedArousal,
            interventionAfter, terminationAfter, dissociationTerminationAfter, guardianNotifyAfter,
            prolongedNegativeIntensity, prolongedNegativeAfter, clearReadingsToReset);
    }

    @Bean
    public SafetyMonitor safetyMonitor(SafetyThresholds safetyThresholds) {
        return new SafetyMonitor(safetyThresholds);
    }

    @Bean
    public DissociationTracker dissociationTracker() {
        return new DissociationTracker();
    }

    @Bean
    public ResponseGenerator responseGenerator() {
        return new ResponseGenerator(new ResponsePreferences(groundingTechniques, mirroringSensitivity));
    }

    @Bean
    public ResponseTriggerPolicy responseTriggerPolicy() {
        Random random = responseRandomSeed >= 0 ? new Random(responseRandomSeed) : new Random();
        return new ResponseTriggerPolicy(responseSensitivity, random);
    }

    @Bean
    public StateHistory stateHistory() {
        return new StateHistory(historyCapacity);
    }

    // ── collaborators ──

    @Bean
    public InMemorySessionRecordSink inMemorySessionRecordSink() {
        return new InMemorySessionRecordSink();
    }

    @Bean
    @Primary
    public SessionRecordSink sessionRecordSink(InMemorySessionRecordSink inMemorySessionRecordSink,
                                               ObjectMapper objectMapper) {
        return new JsonLoggingSessionRecordSink(inMemorySessionRecordSink, objectMapper);
    }

    @Bean
    public SafetyNotificationPublisher safetyNotificationPublisher() {
        return new LoggingSafetyNotificationPublisher(guardianEnabled, guardianContact);
    }

    @Bean
    public CollaboratorSensorService facialSensor() {
        return new CollaboratorSensorService("facial");
    }

    @Bean
    public CollaboratorSensorService physiologicalSensor() {
        return new CollaboratorSensorService("physiological");
    }

    // ── pipeline ──

    @Bean
    public StateFusionEngine stateFusionEngine(SessionTimers sessionTimers, SessionFeeds sessionFeeds) {
        return new StateFusionEngine(sessionTimers, sessionFeeds, fusionTickInterval, stalenessPolicy);
    }

    @Bean
    public ResponseScheduler responseScheduler(SessionTimers sessionTimers, SessionFeeds sessionFeeds,
                                               ResponseGenerator responseGenerator,
                                               ResponseTriggerPolicy responseTriggerPolicy) {
        return new ResponseScheduler(sessionTimers, sessionFeeds, responseGenerator, responseTriggerPolicy,
                                     responseTickInterval, maxQueuedResponses);
    }

    @Bean
    public SafetyProtocolDispatcher safetyProtocolDispatcher(SessionFeeds sessionFeeds,
                                                             SafetyNotificationPublisher safetyNotificationPublisher,
                                                             SessionFlowLogger sessionFlowLogger) {
        return new SafetyProtocolDispatcher(sessionFeeds, safetyNotificationPublisher, sessionFlowLogger);
    }

    @Bean
    public SessionCoordinator sessionCoordinator(SessionTimers sessionTimers,
                                                 SessionFeeds sessionFeeds,
                                                 StateFusionEngine stateFusionEngine,
                                                 DissociationTracker dissociationTracker,
                                                 SafetyMonitor safetyMonitor,
                                                 SafetyProtocolDispatcher safetyProtocolDispatcher,
                                                 ResponseScheduler responseScheduler,
                                                 StateHistory stateHistory,
                                                 SessionRecordSink sessionRecordSink,
                                                 CollaboratorSensorService facialSensor,
                                                 CollaboratorSensorService physiologicalSensor,
                                                 SessionFlowLogger sessionFlowLogger) {
        List<SensorService> sensors = List.of(facialSensor, physiologicalSensor);
        return new SessionCoordinator(sessionTimers, sessionFeeds, stateFusionEngine, dissociationTracker,
                                      safetyMonitor, safetyProtocolDispatcher, responseScheduler, stateHistory,
                                      sessionRecordSink, sensors, sessionFlowLogger,
                                      defaultSessionDuration, autoTerminateOnHighAlert);
    }
}
