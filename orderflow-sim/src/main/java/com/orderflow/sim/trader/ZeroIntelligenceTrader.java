package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * Zero-intelligence constrained trader (Gode &amp; Sunder): a uniformly random
 * price between the system bound and its limit, so it never trades at a loss.
 */
public class ZeroIntelligenceTrader extends AbstractTrader {

    public ZeroIntelligenceTrader(String id, Random random) {
        super(id, TraderType.ZERO_INTELLIGENCE, random);
    }

    @Override
    protected Quote price(MarketView view, CustomerAssignment assignment) {
        long limit = assignment.limitPrice();
        long price;
        if (assignment.side() == Side.BUY) {
            price = uniform(view.minPrice(), limit);
        } else {
            price = uniform(limit, view.maxPrice());
        }
        return quote(assignment, price);
    }

    private long uniform(long low, long high) {
        if (high <= low) {
            return low;
        }
        return low + (long) (random.nextDouble() * (high - low + 1));
    }
}
