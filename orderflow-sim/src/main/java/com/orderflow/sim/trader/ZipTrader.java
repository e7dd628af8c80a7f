package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.core.TopOfBook;
import com.orderflow.core.Trade;
import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * <h1>Zero-Intelligence-Plus (Cliff 1997)</h1>
 *
 * <p>
 * Quotes {@code limit * (1 + margin)} and adapts the margin after every tick
 * with a Widrow-Hoff rule plus momentum, moving the quote towards a target
 * price perturbed around the last trade or the opposite best.
 * </p>
 *
 * <h3>Margin Update</h3>
 * <ul>
 * <li>A deal happened at a price this trader could have beaten: raise the
 * margin (sell higher / buy lower).</li>
 * <li>A deal happened that this trader's quote would have missed: lower the
 * margin.</li>
 * <li>No deal but the same side improved past this trader's quote: chase
 * it.</li>
 * </ul>
 *
 * <p>
 * Separate buy and sell margins are kept so one trader can work either side.
 * Buy margins stay negative, sell margins positive.
 * </p>
 */
public class ZipTrader extends AbstractTrader {

    static final double CA = 0.05;
    static final double CR = 0.05;

    private final double beta;
    private final double momentum;

    private double marginBuy;
    private double marginSell;
    private double margin;
    private double prevChange;

    private boolean active;
    private byte job = -1;
    private long limit;
    private long price;

    private TopOfBook prevBestBid = TopOfBook.EMPTY;
    private TopOfBook prevBestAsk = TopOfBook.EMPTY;

    public ZipTrader(String id, Random random) {
        this(id, TraderType.ZIP, random);
    }

    protected ZipTrader(String id, TraderType type, Random random) {
        super(id, type, random);
        this.beta = 0.1 + 0.4 * random.nextDouble();
        this.momentum = 0.1 * random.nextDouble();
        this.marginBuy = -1.0 * (0.05 + 0.3 * random.nextDouble());
        this.marginSell = 0.05 + 0.3 * random.nextDouble();
    }

    @Override
    protected Quote price(MarketView view, CustomerAssignment assignment) {
        active = true;
        limit = assignment.limitPrice();
        job = assignment.side();
        margin = job == Side.BUY ? marginBuy : marginSell;
        price = checkedPrice(Math.floor(limit * (1 + margin)));
        return quote(assignment, Math.max(price, view.minPrice()));
    }

    @Override
    public void assign(CustomerAssignment assignment) {
        super.assign(assignment);
        active = false;
    }

    @Override
    public void onFill(Trade trade, byte side) {
        super.onFill(trade, side);
        if (assignment() == null) {
            active = false;
        }
    }

    @Override
    public void respond(MarketView view) {
        Trade trade = view.lastTrade();
        TopOfBook bestBid = view.bestBid();
        TopOfBook bestAsk = view.bestAsk();

        boolean bidImproved = false;
        boolean bidHit = false;
        if (!bestBid.isEmpty()) {
            if (prevBestBid.isEmpty() || prevBestBid.price() < bestBid.price()) {
                bidImproved = true;
            } else if (trade != null && (prevBestBid.price() > bestBid.price()
                    || (prevBestBid.price() == bestBid.price() && prevBestBid.quantity() > bestBid.quantity()))) {
                bidHit = true;
            }
        } else if (!prevBestBid.isEmpty()) {
            bidHit = true;
        }

        boolean askImproved = false;
        boolean askLifted = false;
        if (!bestAsk.isEmpty()) {
            if (prevBestAsk.isEmpty() || prevBestAsk.price() > bestAsk.price()) {
                askImproved = true;
            } else if (trade != null && (prevBestAsk.price() < bestAsk.price()
                    || (prevBestAsk.price() == bestAsk.price() && prevBestAsk.quantity() > bestAsk.quantity()))) {
                askLifted = true;
            }
        } else if (!prevBestAsk.isEmpty()) {
            askLifted = true;
        }

        boolean deal = (bidHit || askLifted) && trade != null;

        if (job == Side.SELL) {
            if (deal) {
                long tradePrice = trade.price();
                if (price <= tradePrice) {
                    profitAlter(targetUp(tradePrice));
                } else if (askLifted && active && !willingToTrade(tradePrice)) {
                    profitAlter(targetDown(tradePrice));
                }
            } else if (askImproved && price > bestAsk.price()) {
                profitAlter(bestBid.isEmpty() ? view.maxPrice() : targetUp(bestBid.price()));
            }
        } else if (job == Side.BUY) {
            if (deal) {
                long tradePrice = trade.price();
                if (price >= tradePrice) {
                    profitAlter(targetDown(tradePrice));
                } else if (bidHit && active && !willingToTrade(tradePrice)) {
                    profitAlter(targetUp(tradePrice));
                }
            } else if (bidImproved && price < bestBid.price()) {
                profitAlter(bestAsk.isEmpty() ? view.minPrice() : targetDown(bestAsk.price()));
            }
        }

        prevBestBid = bestBid;
        prevBestAsk = bestAsk;
    }

    private long targetUp(long reference) {
        double absolute = CA * random.nextDouble();
        double relative = reference * (1.0 + CR * random.nextDouble());
        return Math.round(relative + absolute);
    }

    private long targetDown(long reference) {
        double absolute = CA * random.nextDouble();
        double relative = reference * (1.0 - CR * random.nextDouble());
        return Math.round(relative - absolute);
    }

    private boolean willingToTrade(long tradePrice) {
        if (!active) {
            return false;
        }
        return job == Side.BUY ? price >= tradePrice : price <= tradePrice;
    }

    private void profitAlter(long target) {
        double diff = target - price;
        double change = (1.0 - momentum) * (beta * diff) + momentum * prevChange;
        prevChange = change;
        double newMargin = ((price + change) / limit) - 1.0;

        if (job == Side.BUY) {
            if (newMargin < 0.0) {
                marginBuy = newMargin;
                margin = newMargin;
            }
        } else if (newMargin > 0.0) {
            marginSell = newMargin;
            margin = newMargin;
        }
        price = checkedPrice(limit * (1.0 + margin));
    }

    /** Makes {@code price} the reference for the next margin update. */
    protected void requote(long price) {
        this.price = price;
    }

    public double marginBuy() {
        return marginBuy;
    }

    public double marginSell() {
        return marginSell;
    }

    /** The last price this trader quoted or re-targeted to. */
    public long currentPrice() {
        return price;
    }
}
