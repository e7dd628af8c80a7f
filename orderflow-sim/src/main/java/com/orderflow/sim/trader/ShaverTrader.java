package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.core.TopOfBook;
import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * Improves on the best same-side price by a fixed shave, capped at its limit.
 * An empty side gets a stub quote at the system bound.
 */
public class ShaverTrader extends AbstractTrader {

    public ShaverTrader(String id, Random random) {
        this(id, TraderType.SHAVER, random);
    }

    protected ShaverTrader(String id, TraderType type, Random random) {
        super(id, type, random);
    }

    @Override
    protected Quote price(MarketView view, CustomerAssignment assignment) {
        return quote(assignment, shavedPrice(view, assignment, 1));
    }

    protected static long shavedPrice(MarketView view, CustomerAssignment assignment, long shave) {
        if (assignment.side() == Side.BUY) {
            TopOfBook bid = view.bestBid();
            return bid.isEmpty() ? view.minPrice() : capAtLimit(assignment, bid.price() + shave);
        }
        TopOfBook ask = view.bestAsk();
        return ask.isEmpty() ? view.maxPrice() : capAtLimit(assignment, ask.price() - shave);
    }
}
