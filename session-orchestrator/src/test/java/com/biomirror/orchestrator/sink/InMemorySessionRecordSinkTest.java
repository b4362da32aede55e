package com.biomirror.orchestrator.sink;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.dissociation.DissociationSeverity;
import com.biomirror.common.model.EmotionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.biomirror.orchestrator.fixtures.PipelineSamples.state;
import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionRecordSinkTest {

    private static final Instant T = Instant.parse("2026-03-02T09:00:00Z");

    private final InMemorySessionRecordSink sink = new InMemorySessionRecordSink();

    @Test
    @DisplayName("records are sequenced in arrival order and pending until synced")
    void pendingUntilSynced() {
        sink.recordState("s-1", state(T, EmotionType.NEUTRAL, 0.5));
        sink.recordState("s-1", state(T.plusMillis(200), EmotionType.NEUTRAL, 0.5));
        sink.recordEpisode("s-1", new DissociationEpisode(T, T.plusSeconds(7), 0.7, DissociationSeverity.MILD));

        assertEquals(3, sink.pendingSync().size());
        assertEquals(3, sink.getLatestSequence());

        assertEquals(2, sink.markSynced(2));
        assertEquals(0, sink.markSynced(2));

        assertEquals(1, sink.pendingSync().size());
        assertEquals(SessionRecord.Kind.EPISODE, sink.pendingSync().get(0).kind());
    }

    @Test
    @DisplayName("synced records are evicted and later records keep their sequence")
    void syncedRecordsEvicted() {
        for (int i = 0; i < 50; i++) {
            sink.recordState("s-1", state(T.plusMillis(200L * i), EmotionType.NEUTRAL, 0.5));
        }
        assertEquals(50, sink.recordsFor("s-1").size());

        assertEquals(50, sink.markSynced(sink.getLatestSequence()));

        assertEquals(0, sink.size());
        assertTrue(sink.recordsFor("s-1").isEmpty());
        assertTrue(sink.pendingSync().isEmpty());

        sink.recordState("s-1", state(T.plusSeconds(10), EmotionType.NEUTRAL, 0.5));
        assertEquals(1, sink.pendingSync().size());
        assertEquals(51, sink.pendingSync().get(0).sequence());
    }

    @Test
    @DisplayName("records are kept per session")
    void perSession() {
        sink.recordState("s-1", state(T, EmotionType.NEUTRAL, 0.5));
        sink.recordState("s-2", state(T, EmotionType.SADNESS, 0.5));

        assertEquals(1, sink.recordsFor("s-1").size());
        assertEquals(EmotionType.SADNESS, sink.recordsFor("s-2").get(0).state().dominantEmotion());
    }

    @Test
    @DisplayName("the JSON logging decorator forwards every record to its delegate")
    void jsonDecoratorForwards() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        JsonLoggingSessionRecordSink logging = new JsonLoggingSessionRecordSink(sink, mapper);

        logging.recordState("s-1", state(T, EmotionType.HAPPINESS, 0.8));
        logging.recordEpisode("s-1", new DissociationEpisode(T, T.plusSeconds(40), 0.85, DissociationSeverity.MODERATE));

        assertEquals(2, sink.recordsFor("s-1").size());
    }
}
