package com.orderflow.sim.schedule;

import com.orderflow.sim.trader.CustomerAssignment;

/**
 * A customer assignment waiting to be issued to a named trader.
 */
public final class ScheduledAssignment {

    private final String traderId;
    private final CustomerAssignment assignment;

    public ScheduledAssignment(String traderId, CustomerAssignment assignment) {
        this.traderId = traderId;
        this.assignment = assignment;
    }

    public String traderId() {
        return traderId;
    }

    public CustomerAssignment assignment() {
        return assignment;
    }

    public long issueTick() {
        return assignment.issueTick();
    }

    @Override
    public String toString() {
        return traderId + " <- " + assignment;
    }
}
