package com.slotmonitor.sync;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a checked interval into the sub-ranges that still need re-checking, given the confirmed slots found in it.
 * <p>
 * A gap before a confirmed slot is widened to at least {@code intervalSize} slots (never past the parent's end),
 * so a run of small gaps collapses into one re-check. The unresolved tail after the last confirmed slot is always
 * emitted. Candidates are ascending and never overlap; together with the confirmed slots they cover the parent.
 * With a width of 1 nothing is widened, and candidates plus confirmed slots partition the parent exactly.
 */
public final class IntervalSplitter {

    private IntervalSplitter() {
    }

    /**
     * @param interval     the interval that was queried
     * @param confirmed    confirmed slots inside the interval, ascending, without duplicates
     * @param intervalSize minimum width a gap is widened to
     * @return candidate sub-intervals, before size and retention filtering
     */
    public static List<SlotInterval> split(SlotInterval interval, List<Long> confirmed, long intervalSize) {
        if (intervalSize < 1) {
            throw new IllegalArgumentException("intervalSize must be positive");
        }
        List<SlotInterval> candidates = new ArrayList<>();
        if (interval.isEmpty()) {
            return candidates;
        }
        long pos = interval.start();
        for (long slot : confirmed) {
            if (pos > interval.end()) {
                break;
            }
            if (slot > pos) {
                long gapEnd = slot - 1;
                long desiredEnd = Math.min(Math.max(gapEnd, pos + intervalSize - 1), interval.end());
                candidates.add(new SlotInterval(pos, desiredEnd));
                // the confirmed slot that closed the gap is resolved unless the widened gap already covers it
                pos = Math.max(desiredEnd, slot) + 1;
            } else {
                pos = Math.max(pos, slot + 1);
            }
        }
        if (pos <= interval.end()) {
            candidates.add(new SlotInterval(pos, interval.end()));
        }
        return candidates;
    }
}
