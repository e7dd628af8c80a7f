package com.orderflow.sim.trader;

import com.orderflow.core.signal.ImbalanceTracker;
import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * ZIP with the order-flow imbalance shift on top: the margin-derived quote is
 * the baseline, moved towards the offset mid once the tracker has a signal.
 * The shifted price becomes the reference for ZIP's next margin update.
 */
public class ImpactZipTrader extends ZipTrader {

    private final ImbalanceShift shift;

    public ImpactZipTrader(String id, Random random, ImpactParameters parameters) {
        super(id, TraderType.IMPACT_ZIP, random);
        this.shift = new ImbalanceShift(parameters);
    }

    @Override
    protected Quote price(MarketView view, CustomerAssignment assignment) {
        Quote zip = super.price(view, assignment);
        if (!shift.ready(false)) {
            return zip;
        }
        long shifted = shift.apply(this, view, assignment, zip.price());
        requote(shifted);
        return quote(assignment, shifted);
    }

    @Override
    public void respond(MarketView view) {
        super.respond(view);
        shift.observe(view);
    }

    public ImbalanceTracker tracker() {
        return shift.tracker();
    }
}
