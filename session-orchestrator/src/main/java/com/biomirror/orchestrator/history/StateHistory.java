package com.biomirror.orchestrator.history;

import com.biomirror.common.model.EmotionType;
import com.biomirror.common.model.IntegratedState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded ring buffer of the most recent fused states, with window queries over it.
 *
 * <p>Windows end at the newest retained state. Appends come from the fusion tick;
 * reads may come from any thread.
 */
public class StateHistory {

    private final int capacity;
    private final Deque<IntegratedState> states;

    public StateHistory(int capacity) {
        this.capacity = capacity;
        this.states   = new ArrayDeque<>(capacity);
    }

    public synchronized void add(IntegratedState state) {
        states.addLast(state);
        while (states.size() > capacity) {
            states.removeFirst();
        }
    }

    /** Up to {@code limit} most recent states, oldest first. A non-positive limit yields none. */
    public synchronized List<IntegratedState> recentStates(int limit) {
        List<IntegratedState> all = new ArrayList<>(states);
        int count = Math.min(Math.max(0, limit), all.size());
        return new ArrayList<>(all.subList(all.size() - count, all.size()));
    }

    public synchronized int size() {
        return states.size();
    }

    public synchronized void clear() {
        states.clear();
    }

    // ── window queries ────────────────────────────────────────────────────────

    /** Most frequent dominant emotion in the window; ties go to the most recent. */
    public synchronized EmotionType dominantEmotion(Duration window) {
        List<IntegratedState> inWindow = window(window);
        if (inWindow.isEmpty()) return EmotionType.NEUTRAL;

        Map<EmotionType, Integer> counts = new EnumMap<>(EmotionType.class);
        EmotionType best = inWindow.get(inWindow.size() - 1).dominantEmotion();
        for (IntegratedState s : inWindow) {
            counts.merge(s.dominantEmotion(), 1, Integer::sum);
        }
        for (Map.Entry<EmotionType, Integer> e : counts.entrySet()) {
            if (e.getValue() > counts.get(best)) {
                best = e.getKey();
            }
        }
        return best;
    }

    public synchronized double averageCoherence(Duration window) {
        List<IntegratedState> inWindow = window(window);
        if (inWindow.isEmpty()) return 0.0;
        return inWindow.stream().mapToDouble(IntegratedState::coherenceIndex).average().orElse(0.0);
    }

    /** Mean absolute change of emotional intensity between consecutive states in the window. */
    public synchronized double emotionalVolatility(Duration window) {
        List<IntegratedState> inWindow = window(window);
        if (inWindow.size() < 2) return 0.0;
        double total = 0.0;
        for (int i = 1; i < inWindow.size(); i++) {
            total += Math.abs(inWindow.get(i).emotionalIntensity() - inWindow.get(i - 1).emotionalIntensity());
        }
        return total / (inWindow.size() - 1);
    }

    private List<IntegratedState> window(Duration window) {
        if (states.isEmpty()) return List.of();
        Instant from = states.peekLast().timestamp().minus(window);
        List<IntegratedState> out = new ArrayList<>();
        for (IntegratedState s : states) {
            if (!s.timestamp().isBefore(from)) out.add(s);
        }
        return out;
    }
}
