package com.orderflow.sim.schedule;

import com.orderflow.core.Side;
import com.orderflow.sim.trader.CustomerAssignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * <h1>Customer Order Schedule</h1>
 *
 * <p>
 * Replenishes every buyer and every seller with one customer assignment per
 * round. A round is generated as soon as the previous one has been fully
 * issued; its issue ticks spread over the next {@code interval} ticks
 * according to the {@link TimeMode}, and its limit prices over the demand
 * (buyers) or supply (sellers) range according to the {@link StepMode}.
 * </p>
 *
 * <p>
 * Issue times are shuffled across traders, so which trader gets the early
 * slot varies from round to round. Prices are clipped to the system bounds.
 * </p>
 */
public class OrderSchedule {

    private final ScheduleSettings settings;
    private final long minPrice;
    private final long maxPrice;
    private final List<String> buyerIds;
    private final List<String> sellerIds;

    private final List<ScheduledAssignment> pending = new ArrayList<>();

    public OrderSchedule(ScheduleSettings settings, long minPrice, long maxPrice, List<String> buyerIds,
            List<String> sellerIds) {
        this.settings = settings;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.buyerIds = new ArrayList<>(buyerIds);
        this.sellerIds = new ArrayList<>(sellerIds);
    }

    /**
     * Assignments due at {@code tick}, earliest first. Generates the next round
     * when nothing is pending.
     */
    public List<ScheduledAssignment> due(long tick, Random random) {
        if (pending.isEmpty()) {
            replenish(tick, random);
        }
        List<ScheduledAssignment> due = new ArrayList<>();
        Iterator<ScheduledAssignment> it = pending.iterator();
        while (it.hasNext()) {
            ScheduledAssignment next = it.next();
            if (next.issueTick() > tick) {
                break;
            }
            due.add(next);
            it.remove();
        }
        return due;
    }

    void replenish(long tick, Random random) {
        addRound(tick, random, buyerIds, Side.BUY, settings.demandMin(), settings.demandMax());
        addRound(tick, random, sellerIds, Side.SELL, settings.supplyMin(), settings.supplyMax());
        pending.sort(Comparator.comparingLong(ScheduledAssignment::issueTick));
    }

    private void addRound(long tick, Random random, List<String> ids, byte side, long low, long high) {
        if (ids.isEmpty()) {
            return;
        }
        double[] offsets = issueOffsets(ids.size(), settings.timeMode(), settings.interval(), random);
        for (int i = 0; i < ids.size(); i++) {
            long issueTick = tick + Math.round(offsets[i]);
            long price = limitPrice(i, ids.size(), settings.stepMode(), low, high, random);
            pending.add(new ScheduledAssignment(ids.get(i),
                    new CustomerAssignment(side, price, settings.quantity(), issueTick)));
        }
    }

    /**
     * Limit price of the {@code i}-th of {@code n} traders on one side.
     */
    long limitPrice(int i, int n, StepMode mode, long low, long high, Random random) {
        long pmin = clip(low);
        long pmax = clip(high);
        double step = n > 1 ? (double) (pmax - pmin) / (n - 1) : 0;
        long price;
        switch (mode) {
            case FIXED:
                price = pmin + (long) (i * step);
                break;
            case JITTERED:
                long half = Math.round(step / 2.0);
                long jitter = half == 0 ? 0 : random.nextInt((int) (2 * half + 1)) - half;
                price = pmin + (long) (i * step) + jitter;
                break;
            case RANDOM:
                price = pmin + random.nextInt((int) (pmax - pmin + 1));
                break;
            default:
                throw new IllegalStateException("Unknown step mode " + mode);
        }
        return clip(price);
    }

    /**
     * Offsets from the start of the round, one per trader, shuffled. Whatever
     * the mode, the last arrival lands on the interval end.
     */
    static double[] issueOffsets(int n, TimeMode mode, long interval, Random random) {
        double span = interval;
        double step = n == 1 ? span : span / (n - 1);
        double[] offsets = new double[n];
        double arrival = 0;
        for (int t = 0; t < n; t++) {
            switch (mode) {
                case PERIODIC:
                    arrival = span;
                    break;
                case DRIP_FIXED:
                    arrival = t * step;
                    break;
                case DRIP_JITTER:
                    arrival = t * step + step * random.nextDouble();
                    break;
                case DRIP_POISSON:
                    arrival += -Math.log(1.0 - random.nextDouble()) * span / n;
                    break;
                default:
                    throw new IllegalStateException("Unknown time mode " + mode);
            }
            offsets[t] = arrival;
        }

        if (arrival > 0 && arrival != span) {
            for (int t = 0; t < n; t++) {
                offsets[t] = span * (offsets[t] / arrival);
            }
        }

        for (int t = n - 1; t > 0; t--) {
            int j = random.nextInt(t + 1);
            double tmp = offsets[t];
            offsets[t] = offsets[j];
            offsets[j] = tmp;
        }
        return offsets;
    }

    private long clip(long price) {
        return Math.max(minPrice, Math.min(maxPrice, price));
    }

    /** Assignments generated but not yet issued. */
    public List<ScheduledAssignment> pending() {
        return Collections.unmodifiableList(pending);
    }
}
