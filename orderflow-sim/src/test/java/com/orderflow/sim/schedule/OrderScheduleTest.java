package com.orderflow.sim.schedule;

import com.orderflow.core.Side;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderScheduleTest {

    private static final List<String> BUYERS = Arrays.asList("B00", "B01", "B02", "B03", "B04");
    private static final List<String> SELLERS = Arrays.asList("S00", "S01", "S02");

    private static OrderSchedule schedule(TimeMode timeMode, StepMode stepMode) {
        ScheduleSettings settings = new ScheduleSettings(30, timeMode, stepMode, 80, 120, 60, 100, 2);
        return new OrderSchedule(settings, 1, 200, BUYERS, SELLERS);
    }

    @Test
    void fixedStepSpreadsPricesEvenly() {
        OrderSchedule schedule = schedule(TimeMode.PERIODIC, StepMode.FIXED);
        Random random = new Random(1);
        long[] prices = new long[5];
        for (int i = 0; i < 5; i++) {
            prices[i] = schedule.limitPrice(i, 5, StepMode.FIXED, 80, 120, random);
        }
        assertArrayEquals(new long[] {80, 90, 100, 110, 120}, prices);
    }

    @Test
    void singleTraderGetsTheLowEnd() {
        OrderSchedule schedule = schedule(TimeMode.PERIODIC, StepMode.FIXED);
        assertEquals(80, schedule.limitPrice(0, 1, StepMode.FIXED, 80, 120, new Random(1)));
    }

    @Test
    void randomAndJitteredStayNearTheRange() {
        OrderSchedule schedule = schedule(TimeMode.PERIODIC, StepMode.RANDOM);
        Random random = new Random(3);
        for (int k = 0; k < 500; k++) {
            int i = random.nextInt(5);
            long price = schedule.limitPrice(i, 5, StepMode.RANDOM, 80, 120, random);
            assertTrue(price >= 80 && price <= 120, "random " + price);

            long jittered = schedule.limitPrice(i, 5, StepMode.JITTERED, 80, 120, random);
            long fixed = 80 + 10L * i;
            assertTrue(Math.abs(jittered - fixed) <= 5, "jittered " + jittered + " around " + fixed);
        }
    }

    @Test
    void pricesAreClippedToSystemBounds() {
        ScheduleSettings settings = new ScheduleSettings(30, TimeMode.PERIODIC, StepMode.FIXED, 150, 300, 0, 50, 1);
        OrderSchedule schedule = new OrderSchedule(settings, 1, 200, BUYERS, SELLERS);

        schedule.due(0, new Random(1));
        assertEquals(BUYERS.size() + SELLERS.size(), schedule.pending().size());
        for (ScheduledAssignment due : schedule.pending()) {
            long limit = due.assignment().limitPrice();
            assertTrue(limit >= 1 && limit <= 200, "limit " + limit);
        }
    }

    @Test
    void dripFixedSpacesArrivalsAcrossInterval() {
        double[] offsets = OrderSchedule.issueOffsets(4, TimeMode.DRIP_FIXED, 30, new Random(1));
        Arrays.sort(offsets);
        assertArrayEquals(new double[] {0, 10, 20, 30}, offsets, 1e-9);
    }

    @Test
    void periodicIssuesEveryoneAtIntervalEnd() {
        double[] offsets = OrderSchedule.issueOffsets(3, TimeMode.PERIODIC, 30, new Random(1));
        assertArrayEquals(new double[] {30, 30, 30}, offsets, 1e-9);
    }

    @Test
    void poissonAndJitterArrivalsFitTheInterval() {
        Random random = new Random(17);
        for (TimeMode mode : new TimeMode[] {TimeMode.DRIP_POISSON, TimeMode.DRIP_JITTER}) {
            for (int round = 0; round < 50; round++) {
                double[] offsets = OrderSchedule.issueOffsets(6, mode, 300, random);
                double max = Arrays.stream(offsets).max().getAsDouble();
                assertEquals(300, max, 1e-6, mode.name());
                for (double offset : offsets) {
                    assertTrue(offset >= 0 && offset <= 300 + 1e-6, mode + " offset " + offset);
                }
            }
        }
    }

    @Test
    void everyTraderIsReplenishedOncePerRound() {
        OrderSchedule schedule = schedule(TimeMode.DRIP_POISSON, StepMode.FIXED);
        Random random = new Random(5);
        Map<String, Integer> issued = new HashMap<>();
        List<ScheduledAssignment> all = new ArrayList<>();

        for (long tick = 0; tick <= 30; tick++) {
            for (ScheduledAssignment due : schedule.due(tick, random)) {
                assertTrue(due.issueTick() <= tick);
                issued.merge(due.traderId(), 1, Integer::sum);
                all.add(due);
            }
        }

        assertEquals(BUYERS.size() + SELLERS.size(), issued.size());
        assertTrue(issued.values().stream().allMatch(n -> n == 1));
        assertTrue(schedule.pending().isEmpty());
        for (ScheduledAssignment due : all) {
            byte expected = due.traderId().startsWith("B") ? Side.BUY : Side.SELL;
            assertEquals(expected, due.assignment().side());
            assertEquals(2, due.assignment().quantity());
        }

        // the next round starts as soon as the last one is out
        List<ScheduledAssignment> next = schedule.due(31, random);
        assertEquals(BUYERS.size() + SELLERS.size(), next.size() + schedule.pending().size());
        for (ScheduledAssignment due : schedule.pending()) {
            assertTrue(due.issueTick() > 31 && due.issueTick() <= 61);
        }
    }

    @Test
    void settingsNormaliseReversedRanges() {
        ScheduleSettings settings = new ScheduleSettings(10, TimeMode.PERIODIC, StepMode.FIXED, 120, 80, 100, 60, 1);
        assertEquals(80, settings.demandMin());
        assertEquals(120, settings.demandMax());
        assertEquals(60, settings.supplyMin());
        assertEquals(100, settings.supplyMax());
    }
}
