package com.orderflow.sim.trader;

import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * Quotes exactly at its limit, giving away any surplus to the counterparty.
 */
public class GiveawayTrader extends AbstractTrader {

    public GiveawayTrader(String id, Random random) {
        super(id, TraderType.GIVEAWAY, random);
    }

    @Override
    protected Quote price(MarketView view, CustomerAssignment assignment) {
        return quote(assignment, assignment.limitPrice());
    }
}
