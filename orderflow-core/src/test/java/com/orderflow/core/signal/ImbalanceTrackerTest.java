package com.orderflow.core.signal;

import com.orderflow.core.LevelSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImbalanceTrackerTest {

    private static LevelSnapshot top(long rev, long bidQty, long askQty) {
        return new LevelSnapshot(rev, new long[] {100}, new long[] {bidQty}, new long[] {102}, new long[] {askQty});
    }

    @Test
    void firstSnapshotOnlyPrimes() {
        ImbalanceTracker tracker = new ImbalanceTracker(1);

        assertNull(tracker.update(top(1, 5, 5)));
        assertFalse(tracker.hasSignal());
        assertEquals(0, tracker.priceOffset(5.0, 0.8));
        assertEquals(0.0, tracker.volumeRatio(), 1e-12);
    }

    @Test
    void quietTicksRecordZeroSamples() {
        ImbalanceTracker tracker = new ImbalanceTracker(1);
        tracker.update(top(1, 5, 5));

        assertNotNull(tracker.update(top(2, 9, 5)));
        assertEquals(0, tracker.update(top(2, 9, 5)).aggregate());
        assertEquals(2, tracker.sampleCount());
        assertEquals(4, tracker.cumulativeImbalance(0));
    }

    @Test
    void windowKeepsOnlyRecentSamples() {
        ImbalanceTracker tracker = new ImbalanceTracker(1, 2);
        tracker.update(top(1, 5, 5));
        tracker.update(top(2, 10, 5)); // +5
        tracker.update(top(3, 11, 5)); // +1
        tracker.update(top(4, 13, 5)); // +2

        assertEquals(2, tracker.sampleCount());
        assertEquals(3, tracker.cumulativeImbalance(0));
        assertEquals(2, tracker.latestSample().aggregate());
        assertEquals((8.0 + 9.0) / 2, tracker.meanDepth(0), 1e-12);
    }

    @Test
    void priceOffsetScalesImbalanceByDepth() {
        ImbalanceTracker tracker = new ImbalanceTracker(1);
        tracker.update(top(1, 5, 5));
        tracker.update(top(2, 9, 5));

        // 4 * 5 / ((9 + 5) / 2 + 1) = 2.5
        assertEquals(2, tracker.priceOffset(5.0, 0.8));
    }

    @Test
    void negativeOffsetTruncatesTowardZero() {
        ImbalanceTracker tracker = new ImbalanceTracker(1);
        tracker.update(top(1, 5, 5));
        tracker.update(top(2, 2, 5));

        // -3 * 5 / ((2 + 5) / 2 + 1) = -3.33
        assertEquals(-3, tracker.priceOffset(5.0, 0.8));
    }

    @Test
    void deeperLevelsAreDecayed() {
        ImbalanceTracker tracker = new ImbalanceTracker(2);
        LevelSnapshot prev = new LevelSnapshot(1, new long[] {100, 99}, new long[] {0, 0}, new long[] {102, 103},
                new long[] {0, 0});
        LevelSnapshot curr = new LevelSnapshot(2, new long[] {100, 99}, new long[] {0, 10}, new long[] {102, 103},
                new long[] {0, 0});
        tracker.update(prev);
        tracker.update(curr);

        // level 1: 10 * 5 * 0.5 / (5 + 1)
        assertEquals(4, tracker.priceOffset(5.0, 0.5));
        assertEquals(0, tracker.priceOffset(5.0, 0.0));
    }

    @Test
    void volumeRatioFollowsTheHeavierSide() {
        ImbalanceTracker tracker = new ImbalanceTracker(1);
        tracker.update(top(1, 5, 5));
        tracker.update(top(2, 40, 2));

        assertTrue(tracker.volumeRatio() > 0.6);
    }

    @Test
    void resetForgetsEverything() {
        ImbalanceTracker tracker = new ImbalanceTracker(1);
        tracker.update(top(1, 5, 5));
        tracker.update(top(2, 9, 5));

        tracker.reset();

        assertFalse(tracker.hasSignal());
        assertNull(tracker.update(top(3, 1, 1)));
    }

    @Test
    void rejectsBadDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new ImbalanceTracker(0));
        assertThrows(IllegalArgumentException.class, () -> new ImbalanceTracker(3, 0));
    }
}
