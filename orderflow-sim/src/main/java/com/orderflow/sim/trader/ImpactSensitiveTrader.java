package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.core.TopOfBook;
import com.orderflow.core.signal.ImbalanceTracker;
import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * <h1>Impact-Sensitive Trader</h1>
 *
 * <p>
 * Starts from a baseline quote (the best same-side price, capped at the
 * limit) and, when the order-flow imbalance says so, moves it towards the mid
 * shifted by the imbalance-implied offset:
 * </p>
 *
 * <pre>
 *   q' = q + aggression * (mid + offset - q)        capped at the limit
 * </pre>
 *
 * <p>
 * Positive imbalance (net buying pressure) lifts the target, so buyers bid
 * more and sellers ask more; negative imbalance does the opposite. Late in the
 * session ({@code countdown < endgameFraction}) a shifted quote crosses to
 * the opposite best when that price is strictly inside the limit.
 * </p>
 *
 * <h3>Variants</h3>
 * <ul>
 * <li>{@link TraderType#IMPACT_SENSITIVE}: shifts whenever the tracker has
 * seen at least two snapshots.</li>
 * <li>{@link TraderType#IMPACT_SENSITIVE_FILTERED}: shifts only when the
 * depth-weighted volume ratio is significant, otherwise quotes the
 * baseline.</li>
 * </ul>
 * <p>
 * {@link ImpactZipTrader} applies the same shift to a ZIP baseline.
 * </p>
 *
 * <p>
 * The tracker is fed from {@link #respond(MarketView)} once per tick, so the
 * signal always lags the market by one tick.
 * </p>
 */
public class ImpactSensitiveTrader extends AbstractTrader {

    private final ImbalanceShift shift;
    private final boolean filtered;

    public ImpactSensitiveTrader(String id, Random random, ImpactParameters parameters, boolean filtered) {
        super(id, filtered ? TraderType.IMPACT_SENSITIVE_FILTERED : TraderType.IMPACT_SENSITIVE, random);
        this.shift = new ImbalanceShift(parameters);
        this.filtered = filtered;
    }

    @Override
    public void respond(MarketView view) {
        shift.observe(view);
    }

    @Override
    protected Quote price(MarketView view, CustomerAssignment assignment) {
        long baseline = baseline(view, assignment);
        if (!shouldShift()) {
            return quote(assignment, baseline);
        }
        return quote(assignment, shift.apply(this, view, assignment, baseline));
    }

    boolean shouldShift() {
        return shift.ready(filtered);
    }

    static long baseline(MarketView view, CustomerAssignment assignment) {
        TopOfBook best = view.best(assignment.side());
        if (best.isEmpty()) {
            return assignment.side() == Side.BUY ? view.minPrice() : view.maxPrice();
        }
        return capAtLimit(assignment, best.price());
    }

    public ImbalanceTracker tracker() {
        return shift.tracker();
    }

    public ImpactParameters parameters() {
        return shift.parameters();
    }

    public boolean isFiltered() {
        return filtered;
    }
}
