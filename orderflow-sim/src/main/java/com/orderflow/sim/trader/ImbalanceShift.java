package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.core.TopOfBook;
import com.orderflow.core.signal.ImbalanceSignal;
import com.orderflow.core.signal.ImbalanceTracker;
import com.orderflow.sim.MarketView;

/**
 * The imbalance adjustment shared by the impact-sensitive variants: an
 * {@link ImbalanceTracker} fed once per tick, and the rule that moves a
 * baseline quote towards the offset mid.
 */
final class ImbalanceShift {

    private final ImpactParameters parameters;
    private final ImbalanceTracker tracker;

    ImbalanceShift(ImpactParameters parameters) {
        this.parameters = parameters;
        this.tracker = new ImbalanceTracker(parameters.depth(), parameters.window());
    }

    void observe(MarketView view) {
        tracker.update(view.levels());
    }

    boolean ready(boolean filtered) {
        if (!tracker.hasSignal()) {
            return false;
        }
        return !filtered || ImbalanceSignal.isImbalanceSignificant(tracker.volumeRatio(), parameters.threshold());
    }

    /**
     * {@code baseline + aggression * (mid + offset - baseline)}, capped at the
     * limit; in the endgame, the opposite best when it is strictly inside the
     * limit. Always within the system price bounds.
     */
    long apply(AbstractTrader trader, MarketView view, CustomerAssignment assignment, long baseline) {
        long offset = tracker.priceOffset(parameters.scale(), parameters.decay());
        double benchmark = view.hasMidPrice() ? view.midPrice() : baseline;
        double target = baseline + parameters.aggression() * (benchmark + offset - baseline);
        long price = AbstractTrader.capAtLimit(assignment, trader.checkedPrice(target));

        if (view.countdown() < parameters.endgameFraction()) {
            TopOfBook opposite = view.best(Side.opposite(assignment.side()));
            if (!opposite.isEmpty()) {
                long limit = assignment.limitPrice();
                if (assignment.side() == Side.BUY && opposite.price() < limit) {
                    price = opposite.price();
                } else if (assignment.side() == Side.SELL && opposite.price() > limit) {
                    price = opposite.price();
                }
            }
        }
        return Math.max(view.minPrice(), Math.min(view.maxPrice(), price));
    }

    ImbalanceTracker tracker() {
        return tracker;
    }

    ImpactParameters parameters() {
        return parameters;
    }
}
