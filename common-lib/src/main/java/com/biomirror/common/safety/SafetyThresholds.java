package com.biomirror.common.safety;

import java.time.Duration;

/**
 * Single authoritative threshold table for every safety decision: the per-tick
 * escalation rules, the sustained-distress intervention and termination checks,
 * and the reset hysteresis.
 *
 * @param distressIntensity           intensity above which a distress emotion is severe
 * @param distressArousal             arousal required alongside severe distress
 * @param severeDissociation          dissociation index treated as severe
 * @param extremeArousal              arousal for the extreme-arousal trigger
 * @param extremeHeartRate            heart rate (bpm) for the extreme-arousal trigger
 * @param sustainedArousal            arousal that starts the sustained-distress timer
 * @param interventionAfter           sustained distress that requires intervention
 * @param terminationAfter            sustained distress that requires termination
 * @param dissociationTerminationAfter severe dissociation persistence that requires termination
 * @param guardianNotifyAfter         session age after which medium alerts notify the guardian
 * @param prolongedNegativeIntensity  intensity for the prolonged-negative-state trigger
 * @param prolongedNegativeAfter      persistence for the prolonged-negative-state trigger
 * @param clearReadingsToReset        consecutive clear readings that close an escalation
 */
public record SafetyThresholds(
    double distressIntensity,
    double distressArousal,
    double severeDissociation,
    double extremeArousal,
    double extremeHeartRate,
    double sustainedArousal,
    Duration interventionAfter,
    Duration terminationAfter,
    Duration dissociationTerminationAfter,
    Duration guardianNotifyAfter,
    double prolongedNegativeIntensity,
    Duration prolongedNegativeAfter,
    int clearReadingsToReset
) {

    public static SafetyThresholds defaults() {
        return new SafetyThresholds(
            0.8, 0.7,
            0.8,
            0.9, 120,
            0.9,
            Duration.ofSeconds(120),
            Duration.ofSeconds(240),
            Duration.ofSeconds(30),
            Duration.ofMinutes(5),
            0.6, Duration.ofSeconds(60),
            10
        );
    }

    public SafetyThresholds withClearReadingsToReset(int readings) {
        return new SafetyThresholds(distressIntensity, distressArousal, severeDissociation,
            extremeArousal, extremeHeartRate, sustainedArousal, interventionAfter, terminationAfter,
            dissociationTerminationAfter, guardianNotifyAfter, prolongedNegativeIntensity,
            prolongedNegativeAfter, readings);
    }
}
