package com.project.image.fiducial.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Picks the two most prominent narrow spikes lying close to either end of the profile.
 * <p>
 * Candidates are the (min, max, min) runs of consecutive extrema. A candidate is eligible when its minima
 * are fewer than {@code peakWidthMax} samples apart and its peak lies within {@code peakDistMax} samples of
 * the start or the end of the profile. Eligible candidates are fed left to right into a
 * {@link TopTwoSelection}.
 */
public class SpikePairSelector {
    private static final Logger log = LoggerFactory.getLogger(SpikePairSelector.class);

    private final int peakWidthMax;
    private final int peakDistMax;

    public SpikePairSelector(int peakWidthMax, int peakDistMax) {
        if (peakWidthMax <= 0 || peakDistMax <= 0) {
            throw new IllegalArgumentException("peakWidthMax and peakDistMax must be positive, got "
                    + peakWidthMax + " and " + peakDistMax);
        }
        this.peakWidthMax = peakWidthMax;
        this.peakDistMax = peakDistMax;
    }

    public int getPeakWidthMax() {
        return peakWidthMax;
    }

    public int getPeakDistMax() {
        return peakDistMax;
    }

    public SpikePair select(List<Extremum> extrema, double[] profile) {
        int extent = profile.length;
        TopTwoSelection selection = new TopTwoSelection();
        for (int i = 0; i + 2 < extrema.size(); i++) {
            Extremum left = extrema.get(i);
            Extremum peak = extrema.get(i + 1);
            Extremum right = extrema.get(i + 2);
            if (left.isMax() || !peak.isMax() || right.isMax()) {
                continue;
            }
            SpikeCandidate candidate = SpikeCandidate.of(profile, left.index(), peak.index(), right.index());
            if (isEligible(candidate, extent)) {
                boolean taken = selection.offer(candidate);
                log.trace("Candidate at {} (h={}, width={}) {}", candidate.peak(), candidate.prominence(),
                        candidate.width(), taken ? "taken" : "dropped");
            }
        }
        return selection.result();
    }

    boolean isEligible(SpikeCandidate candidate, int extent) {
        if (candidate.width() >= peakWidthMax) {
            return false;
        }
        int peak = candidate.peak();
        return peak < peakDistMax || peak > extent - peakDistMax;
    }
}
