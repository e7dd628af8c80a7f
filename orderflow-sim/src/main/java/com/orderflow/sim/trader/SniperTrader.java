package com.orderflow.sim.trader;

import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * A shaver that lurks until the closing part of the session, then shaves by
 * an amount that grows as the clock runs out.
 */
public class SniperTrader extends ShaverTrader {

    static final double LURK_THRESHOLD = 0.2;
    static final double SHAVE_GROWTH_RATE = 3;

    public SniperTrader(String id, Random random) {
        super(id, TraderType.SNIPER, random);
    }

    @Override
    protected Quote price(MarketView view, CustomerAssignment assignment) {
        double countdown = view.countdown();
        if (countdown > LURK_THRESHOLD) {
            return null;
        }
        return quote(assignment, shavedPrice(view, assignment, shave(countdown)));
    }

    static long shave(double countdown) {
        return (long) (1.0 / (0.01 + countdown / (SHAVE_GROWTH_RATE * LURK_THRESHOLD)));
    }
}
