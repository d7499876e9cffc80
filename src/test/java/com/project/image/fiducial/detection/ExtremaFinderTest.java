package com.project.image.fiducial.detection;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtremaFinderTest {
    private final ExtremaFinder finder = new ExtremaFinder();

    @Test
    void isolated_spike_onFlatBase_givesMinMaxMin() {
        assertThat(finder.find(new double[]{0, 0, 1, 5, 1, 0, 0}))
                .containsExactly(Extremum.min(1), Extremum.max(3), Extremum.min(5));
    }

    @Test
    void valley_peak_valley_isReportedAtSignChanges() {
        assertThat(finder.find(new double[]{3, 1, 2, 9, 2, 1, 3}))
                .containsExactly(Extremum.min(1), Extremum.max(3), Extremum.min(5));
    }

    @Test
    void shelf_onRisingSlope_isNotAnExtremum() {
        assertThat(finder.find(new double[]{0, 1, 1, 1, 2, 0}))
                .containsExactly(Extremum.max(4));
    }

    @Test
    void flat_top_isReportedAtItsFirstSample() {
        assertThat(finder.find(new double[]{0, 2, 2, 2, 0}))
                .containsExactly(Extremum.max(1));
    }

    @Test
    void monotonic_and_constant_profiles_haveNoExtrema() {
        assertThat(finder.find(new double[]{1, 2, 3, 4})).isEmpty();
        assertThat(finder.find(new double[]{7, 7, 7, 7, 7})).isEmpty();
        assertThat(finder.find(new double[]{42})).isEmpty();
    }

    @Test
    void rounding_residue_onSmoothedConstant_isIgnored() {
        double[] flat = new double[1000];
        Arrays.fill(flat, 37.4);
        double[] smoothed = new ProfileSmoother(9, 2).smooth(flat, 10);

        assertThat(finder.find(smoothed)).isEmpty();
    }

    @Test
    void kinds_alternate_onSmoothedBandProfile() {
        double[] profile = new double[1000];
        Arrays.fill(profile, 128);
        for (int r = 100; r < 105; r++) {
            profile[r] = 40;
            profile[r + 800] = 40;
        }
        List<Extremum> extrema = finder.find(new ProfileSmoother(9, 2).smooth(profile, 10));

        assertThat(extrema).isNotEmpty();
        for (int i = 1; i < extrema.size(); i++) {
            assertThat(extrema.get(i).index()).isGreaterThan(extrema.get(i - 1).index());
            assertThat(extrema.get(i).kind()).isNotEqualTo(extrema.get(i - 1).kind());
        }
    }
}
