package com.biomirror.common.session;

import com.biomirror.common.dissociation.DissociationEpisode;
import com.biomirror.common.dissociation.DissociationSeverity;
import com.biomirror.common.model.DataQuality;
import com.biomirror.common.model.EmotionType;
import com.biomirror.common.model.IntegratedState;
import com.biomirror.common.model.RegulationState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.biomirror.common.fixtures.Samples.at;
import static com.biomirror.common.fixtures.Samples.state;
import static org.junit.jupiter.api.Assertions.*;

class SessionMetricsCalculatorTest {

    private static final double EPS = 1e-9;

    private static IntegratedState s(double t, EmotionType e, double arousal, double coherence,
                                     RegulationState regulation) {
        return state(at(t), e, 0.5, arousal, coherence, 0.1, 80, DataQuality.GOOD, regulation, 0.1);
    }

    @Nested
    @DisplayName("Coherence and range")
    class CoherenceAndRange {

        @Test
        void averageCoherenceIsArithmeticMean() {
            List<IntegratedState> states = List.of(
                s(0, EmotionType.HAPPINESS, 0.5, 0.2, RegulationState.REGULATED),
                s(1, EmotionType.SADNESS, 0.5, 0.4, RegulationState.REGULATED),
                s(2, EmotionType.SADNESS, 0.5, 0.9, RegulationState.REGULATED));
            SessionMetrics m = SessionMetricsCalculator.compute(states, List.of(), 0, at(0), at(3));

            assertEquals(0.5, m.averageCoherenceIndex(), EPS);
            assertEquals(Set.of(EmotionType.HAPPINESS, EmotionType.SADNESS), m.emotionsExpressed());
            assertEquals(2.0 / 15.0, m.emotionalRangeIndex(), EPS);
        }

        @Test
        void emptySessionIsZero() {
            SessionMetrics m = SessionMetricsCalculator.compute(List.of(), List.of(), 0, at(0), at(0));
            assertEquals(0.0, m.averageCoherenceIndex());
            assertEquals(0.0, m.percentageTimeInDissociation());
            assertEquals(0.5, m.regulationCapacity());
        }
    }

    @Nested
    @DisplayName("Regulation")
    class Regulation {

        private final List<IntegratedState> recovery = List.of(
            s(0, EmotionType.ANGER, 0.8, 0.5, RegulationState.REGULATED),
            s(10, EmotionType.ANGER, 0.65, 0.5, RegulationState.REGULATED),
            s(20, EmotionType.NEUTRAL, 0.5, 0.5, RegulationState.REGULATED),
            s(30, EmotionType.NEUTRAL, 0.5, 0.5, RegulationState.REGULATED),
            s(40, EmotionType.NEUTRAL, 0.5, 0.5, RegulationState.REGULATED),
            s(60, EmotionType.NEUTRAL, 0.3, 0.5, RegulationState.REGULATED));

        @Test
        @DisplayName("capacity averages regulated ratio and recovery speed")
        void capacity() {
            assertEquals(0.75, SessionMetricsCalculator.regulationCapacity(recovery), EPS);
        }

        @Test
        void peakAndFastestRecovery() {
            SessionMetrics m = SessionMetricsCalculator.compute(recovery, List.of(), 0, at(0), at(60));
            assertEquals(0.8, m.peakArousal(), EPS);
            assertEquals(at(0), m.timeOfPeakArousal());
            assertEquals(Duration.ofSeconds(20), m.regulationRecoveryTime());
        }

        @Test
        void improvementComparesThirds() {
            List<IntegratedState> states = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                states.add(s(i, EmotionType.NEUTRAL, 0.5, 0.5,
                    i < 4 ? RegulationState.MODERATE_DYSREGULATION : RegulationState.REGULATED));
            }
            assertEquals(1.0, SessionMetricsCalculator.regulationImprovement(states), EPS);
        }
    }

    @Test
    void dissociationTotalsAndMasking() {
        List<DissociationEpisode> episodes = List.of(
            new DissociationEpisode(at(10), at(16), 0.7, DissociationSeverity.MILD),
            new DissociationEpisode(at(50), at(60), 0.75, DissociationSeverity.MILD));
        List<IntegratedState> states = List.of(
            state(at(1), EmotionType.NEUTRAL, 0.5, 0.8, 0.1, 0.1, 80, DataQuality.GOOD, RegulationState.REGULATED, 0.9),
            s(2, EmotionType.NEUTRAL, 0.5, 0.5, RegulationState.REGULATED));

        SessionMetrics m = SessionMetricsCalculator.compute(states, episodes, 4, at(0), at(160));

        assertEquals(2, m.dissociationEpisodeCount());
        assertEquals(Duration.ofSeconds(16), m.totalDissociationTime());
        assertEquals(10.0, m.percentageTimeInDissociation(), EPS);
        assertEquals(1, m.emotionalMaskingInstances());
        assertEquals(4, m.interventionsDelivered());
        assertEquals(Duration.ofSeconds(160), m.sessionDuration());
    }

    @Test
    void endedSessionRejectsFurtherAppends() {
        TherapeuticSession session = new TherapeuticSession("s-1", SessionPhase.CONNECTION, at(0), Duration.ofMinutes(20));
        session.addState(s(1, EmotionType.NEUTRAL, 0.5, 0.6, RegulationState.REGULATED));
        SessionMetrics metrics = session.end(at(2));

        assertEquals(0.6, metrics.averageCoherenceIndex(), EPS);
        assertTrue(session.isEnded());
        assertThrows(IllegalStateException.class,
            () -> session.addState(s(3, EmotionType.NEUTRAL, 0.5, 0.6, RegulationState.REGULATED)));
        assertThrows(IllegalStateException.class, () -> session.end(at(4)));
    }
}
