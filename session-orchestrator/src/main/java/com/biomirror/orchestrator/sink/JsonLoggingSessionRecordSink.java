package com.biomirror.orchestrator.sink;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.sink.SessionRecordSink;
import com.biomirror.common.trace.SessionTraceUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that logs each record as JSON at DEBUG before handing it to the delegate.
 * Episodes are logged at INFO since they are rare.
 */
public class JsonLoggingSessionRecordSink implements SessionRecordSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLoggingSessionRecordSink.class);

    private final SessionRecordSink delegate;
    private final ObjectMapper objectMapper;

    public JsonLoggingSessionRecordSink(SessionRecordSink delegate, ObjectMapper objectMapper) {
        this.delegate     = delegate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void recordState(String sessionId, IntegratedState state) {
        if (log.isDebugEnabled()) {
            String json = toJson(state);
            SessionTraceUtil.withMdc(sessionId, () -> log.debug("STATE_RECORDED {}", json));
        }
        delegate.recordState(sessionId, state);
    }

    @Override
    public void recordEpisode(String sessionId, DissociationEpisode episode) {
        String json = toJson(episode);
        SessionTraceUtil.withMdc(sessionId, () -> log.info("EPISODE_RECORDED {}", json));
        delegate.recordEpisode(sessionId, episode);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("RECORD_SERIALIZATION_FAILED type={} error={}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
