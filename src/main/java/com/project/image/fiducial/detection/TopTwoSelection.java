package com.project.image.fiducial.detection;

/**
 * Streaming selection of the two most prominent candidates.
 * <p>
 * Each offer targets the weaker slot, the first slot when both are equal (including both empty). The
 * candidate replaces the target only if it is strictly more prominent, so among equal candidates the earlier
 * one is kept; a later candidate equal to the weaker slot is dropped.
 */
public final class TopTwoSelection {

    enum Slot { FIRST, SECOND }

    private SpikeCandidate first = SpikeCandidate.EMPTY;
    private SpikeCandidate second = SpikeCandidate.EMPTY;
    private int offered;

    /**
     * @return true if the candidate took a slot
     */
    public boolean offer(SpikeCandidate candidate) {
        offered++;
        Slot target = target();
        SpikeCandidate current = target == Slot.FIRST ? first : second;
        if (candidate.prominence() <= current.prominence()) {
            return false;
        }
        if (target == Slot.FIRST) {
            first = candidate;
        } else {
            second = candidate;
        }
        return true;
    }

    Slot target() {
        return first.prominence() <= second.prominence() ? Slot.FIRST : Slot.SECOND;
    }

    /** Slot contents in scan order, before the final ordering by prominence. */
    SpikeCandidate first() {
        return first;
    }

    SpikeCandidate second() {
        return second;
    }

    public int offered() {
        return offered;
    }

    public SpikePair result() {
        return SpikePair.ordered(first, second, offered);
    }
}
