package org.pcfgstego.api;

import org.pcfgstego.codec.detect.DetectionResult;
import org.pcfgstego.codec.search.KeyCandidate;

import java.util.List;

/**
 * Detection outcome plus the ranked key guesses, when keys were supplied.
 *
 * @param detection The reconstructed bits and match trace.
 * @param recoveries Ranked key candidates; empty when no keys were given or nothing was detected.
 */
public record DetectionReport(DetectionResult detection, List<KeyCandidate> recoveries) {
    public DetectionReport {
        recoveries = List.copyOf(recoveries);
    }

    public boolean detected() {
        return detection.detected();
    }

    public String bits() {
        return detection.bits();
    }
}
