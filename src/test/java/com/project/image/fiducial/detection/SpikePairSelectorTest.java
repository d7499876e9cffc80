package com.project.image.fiducial.detection;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SpikePairSelectorTest {

    private static final int LENGTH = 1000;

    private final SpikePairSelector selector = new SpikePairSelector(80, 100);

    /** Builds a zero profile with one spike of the given height per peak, minima two samples either side. */
    private static Spikes spikes(int[] peaks, double[] heights) {
        double[] profile = new double[LENGTH];
        List<Extremum> extrema = new ArrayList<>();
        for (int i = 0; i < peaks.length; i++) {
            profile[peaks[i]] = heights[i];
            extrema.add(Extremum.min(peaks[i] - 2));
            extrema.add(Extremum.max(peaks[i]));
            extrema.add(Extremum.min(peaks[i] + 2));
        }
        return new Spikes(profile, extrema);
    }

    private record Spikes(double[] profile, List<Extremum> extrema) {}

    @Test
    void single_spike_fillsOnlyFirstSlot() {
        Spikes s = spikes(new int[]{50}, new double[]{6});

        SpikePair pair = selector.select(s.extrema(), s.profile());

        assertThat(pair.peak1()).isEqualTo(50);
        assertThat(pair.spike1().prominence()).isEqualTo(12);
        assertThat(pair.spike2().isEmpty()).isTrue();
        assertThat(pair.peak2()).isZero();
        assertThat(pair.isComplete()).isFalse();
    }

    @Test
    void two_spikes_largerFirst_regardlessOfOrder() {
        Spikes tallFirst = spikes(new int[]{50, 950}, new double[]{9, 4});
        Spikes tallLast = spikes(new int[]{50, 950}, new double[]{4, 9});

        SpikePair a = selector.select(tallFirst.extrema(), tallFirst.profile());
        SpikePair b = selector.select(tallLast.extrema(), tallLast.profile());

        assertThat(a.peak1()).isEqualTo(50);
        assertThat(a.peak2()).isEqualTo(950);
        assertThat(b.peak1()).isEqualTo(950);
        assertThat(b.peak2()).isEqualTo(50);
        assertThat(a.separation()).isEqualTo(b.separation()).isEqualTo(900);
    }

    @Test
    void wide_candidates_areRejected() {
        double[] profile = new double[LENGTH];
        profile[40] = 50;
        profile[960] = 5;
        List<Extremum> extrema = List.of(
                Extremum.min(0), Extremum.max(40), Extremum.min(80),      // width 80
                Extremum.max(940), Extremum.min(950),                     // (80, 940, 950) is wide too
                Extremum.max(960), Extremum.min(989));                    // width 39

        SpikePair pair = selector.select(extrema, profile);

        // the broad spike is by far the most prominent feature and is still ignored
        assertThat(SpikeCandidate.of(profile, 0, 40, 80).prominence()).isEqualTo(100);
        assertThat(pair.eligibleCount()).isEqualTo(1);
        assertThat(pair.peak1()).isEqualTo(960);
        assertThat(pair.spike1().prominence()).isEqualTo(10);
        assertThat(pair.isComplete()).isFalse();
    }

    @Test
    void candidates_farFromBothEnds_areRejected() {
        Spikes s = spikes(new int[]{60, 100, 500, 900, 940}, new double[]{1, 9, 9, 9, 2});

        SpikePair pair = selector.select(s.extrema(), s.profile());

        assertThat(pair.eligibleCount()).isEqualTo(2);
        assertThat(pair.peak1()).isEqualTo(940);
        assertThat(pair.peak2()).isEqualTo(60);
    }

    @Test
    void eligibility_boundaries() {
        assertThat(selector.isEligible(new SpikeCandidate(0, 5, 79, 1, 1), LENGTH)).isTrue();
        assertThat(selector.isEligible(new SpikeCandidate(0, 5, 80, 1, 1), LENGTH)).isFalse();
        assertThat(selector.isEligible(new SpikeCandidate(97, 99, 101, 1, 1), LENGTH)).isTrue();
        assertThat(selector.isEligible(new SpikeCandidate(98, 100, 102, 1, 1), LENGTH)).isFalse();
        assertThat(selector.isEligible(new SpikeCandidate(898, 900, 902, 1, 1), LENGTH)).isFalse();
        assertThat(selector.isEligible(new SpikeCandidate(899, 901, 903, 1, 1), LENGTH)).isTrue();
    }

    @Test
    void triples_notStartingWithMinimum_areSkipped() {
        double[] profile = {5, 0, 5, 0, 5};
        List<Extremum> extrema = List.of(Extremum.max(0), Extremum.min(1), Extremum.max(2), Extremum.min(3),
                Extremum.max(4));

        SpikePair pair = new SpikePairSelector(80, 1000).select(extrema, profile);

        assertThat(pair.eligibleCount()).isEqualTo(1);
        assertThat(pair.peak1()).isEqualTo(2);
    }

    @Test
    void non_positive_limits_areRejected() {
        assertThatThrownBy(() -> new SpikePairSelector(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpikePairSelector(10, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
