package com.orderflow.sim.schedule;

/**
 * Shape of the customer order flow: how often assignments are replenished,
 * how their issue times and limit prices are spread, and their size.
 */
public final class ScheduleSettings {

    public static final ScheduleSettings DEFAULTS = new ScheduleSettings(300, TimeMode.DRIP_POISSON, StepMode.FIXED,
            105, 105, 95, 95, 1);

    private final long interval;
    private final TimeMode timeMode;
    private final StepMode stepMode;
    private final long demandMin;
    private final long demandMax;
    private final long supplyMin;
    private final long supplyMax;
    private final long quantity;

    public ScheduleSettings(long interval, TimeMode timeMode, StepMode stepMode, long demandMin, long demandMax,
            long supplyMin, long supplyMax, long quantity) {
        this.interval = interval;
        this.timeMode = timeMode;
        this.stepMode = stepMode;
        this.demandMin = Math.min(demandMin, demandMax);
        this.demandMax = Math.max(demandMin, demandMax);
        this.supplyMin = Math.min(supplyMin, supplyMax);
        this.supplyMax = Math.max(supplyMin, supplyMax);
        this.quantity = quantity;
    }

    public long interval() {
        return interval;
    }

    public TimeMode timeMode() {
        return timeMode;
    }

    public StepMode stepMode() {
        return stepMode;
    }

    public long demandMin() {
        return demandMin;
    }

    public long demandMax() {
        return demandMax;
    }

    public long supplyMin() {
        return supplyMin;
    }

    public long supplyMax() {
        return supplyMax;
    }

    public long quantity() {
        return quantity;
    }

    @Override
    public String toString() {
        return "ScheduleSettings{interval=" + interval + ", " + timeMode + "/" + stepMode + ", demand=[" + demandMin
                + "," + demandMax + "], supply=[" + supplyMin + "," + supplyMax + "], qty=" + quantity + '}';
    }
}
