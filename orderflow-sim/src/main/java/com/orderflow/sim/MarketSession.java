package com.orderflow.sim;

import com.orderflow.core.MatchEventListener;
import com.orderflow.core.MatchingEngine;
import com.orderflow.core.Order;
import com.orderflow.core.OrderBook;
import com.orderflow.core.Side;
import com.orderflow.core.SubmitResult;
import com.orderflow.core.Trade;
import com.orderflow.core.ValidationResult;
import com.orderflow.core.logging.Logger;
import com.orderflow.core.logging.Slf4jLogger;
import com.orderflow.sim.config.SimulationConfig;
import com.orderflow.sim.schedule.OrderSchedule;
import com.orderflow.sim.schedule.ScheduledAssignment;
import com.orderflow.sim.tape.Tape;
import com.orderflow.sim.trader.Quote;
import com.orderflow.sim.trader.Trader;
import com.orderflow.sim.trader.TraderType;
import org.agrona.collections.Object2LongHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * <h1>The Market Session</h1>
 *
 * <p>
 * One trading day: a discrete-event scheduler that owns its
 * {@link OrderBook}, {@link MatchingEngine}, {@link Tape} and trader
 * population exclusively. Nothing here is shared with other sessions.
 * </p>
 *
 * <h3>One Tick</h3>
 * <ol>
 * <li>Issue due customer assignments. A trader receiving a new assignment has
 * its live quote cancelled.</li>
 * <li>Pick one trader uniformly at random and ask it to
 * {@link Trader#decide(MarketView) decide}.</li>
 * <li>Cancel that trader's previous live quote, then submit the new one. Each
 * trader has at most one quote in the book.</li>
 * <li>Let every trader {@link Trader#respond(MarketView) respond} to the
 * post-tick market.</li>
 * </ol>
 *
 * <h3>Zero Latency</h3>
 * <p>
 * Strictly single-threaded. One order is matched to completion, cascading
 * fills included, before anyone else acts, and every trader sees the result
 * in the same tick.
 * </p>
 *
 * <h3>Failure Containment</h3>
 * <p>
 * A {@link RuntimeException} thrown by trader logic is logged and that
 * trader's action for the tick is dropped; the session carries on.
 * </p>
 */
public class MarketSession {

    private static final long NO_ORDER = 0;

    private final String sessionId;
    private final long sessionLength;
    private final long minPrice;
    private final long maxPrice;
    private final int depth;
    private final List<Trader> traders;
    private final Map<String, Trader> tradersById = new LinkedHashMap<>();
    private final OrderSchedule schedule;
    private final Random random;
    private final Logger logger;

    private final OrderBook book;
    private final MatchingEngine engine;
    private final Tape tape;
    private final Object2LongHashMap<String> liveOrders = new Object2LongHashMap<>(NO_ORDER);

    private SessionState state = SessionState.OPEN;
    private volatile boolean stopRequested;
    private long tick;
    private long nextOrderId;
    private Trade lastTrade;
    private int skippedActions;

    public MarketSession(String sessionId, SimulationConfig config, List<Trader> traders, OrderSchedule schedule,
            Random random) {
        this(sessionId, config, traders, schedule, random, new Slf4jLogger(MarketSession.class));
    }

    public MarketSession(String sessionId, SimulationConfig config, List<Trader> traders, OrderSchedule schedule,
            Random random, Logger logger) {
        this.sessionId = sessionId;
        this.sessionLength = config.sessionLength();
        this.minPrice = config.minPrice();
        this.maxPrice = config.maxPrice();
        this.depth = config.depth();
        this.traders = new ArrayList<>(traders);
        this.schedule = schedule;
        this.random = random;
        this.logger = logger;
        for (Trader trader : traders) {
            if (tradersById.put(trader.id(), trader) != null) {
                throw new IllegalArgumentException("Duplicate trader id " + trader.id());
            }
        }

        this.book = new OrderBook(logger);
        this.engine = new MatchingEngine(book, new SessionListener(), logger);
        this.tape = new Tape(sessionId);
    }

    /**
     * Builds the configured population (buyers {@code B00, B01, ...}, sellers
     * {@code S00, ...}) and customer schedule for one trading day.
     */
    public static MarketSession create(String sessionId, SimulationConfig config, Random random) {
        List<Trader> traders = new ArrayList<>();
        List<String> buyerIds = new ArrayList<>();
        List<String> sellerIds = new ArrayList<>();
        populate(config.buyers(), "B", config, random, traders, buyerIds);
        populate(config.sellers(), "S", config, random, traders, sellerIds);
        OrderSchedule schedule = new OrderSchedule(config.schedule(), config.minPrice(), config.maxPrice(), buyerIds,
                sellerIds);
        return new MarketSession(sessionId, config, traders, schedule, random);
    }

    private static void populate(Map<TraderType, Integer> counts, String prefix, SimulationConfig config,
            Random random, List<Trader> traders, List<String> ids) {
        for (Map.Entry<TraderType, Integer> entry : counts.entrySet()) {
            for (int i = 0; i < entry.getValue(); i++) {
                String id = String.format("%s%02d", prefix, ids.size());
                traders.add(entry.getKey().create(id, random, config.imbalance()));
                ids.add(id);
            }
        }
    }

    public void open() {
        if (state != SessionState.OPEN) {
            throw new IllegalStateException("Session " + sessionId + " is " + state);
        }
        state = SessionState.TRADING;
        logger.log("Session " + sessionId + " trading, traders", traders.size());
    }

    /**
     * Runs ticks until the session length is reached or a stop is requested.
     */
    public void run() {
        if (state == SessionState.OPEN) {
            open();
        }
        while (state == SessionState.TRADING) {
            step();
            if (stopRequested && state == SessionState.TRADING) {
                close();
            }
        }
    }

    /**
     * Runs exactly one tick.
     *
     * @throws IllegalStateException unless the session is trading
     */
    public void step() {
        if (state != SessionState.TRADING) {
            throw new IllegalStateException("Session " + sessionId + " is " + state);
        }
        lastTrade = null;

        if (schedule != null) {
            for (ScheduledAssignment due : schedule.due(tick, random)) {
                Trader trader = tradersById.get(due.traderId());
                if (trader == null) {
                    logger.warn("Assignment for unknown trader " + due.traderId());
                    continue;
                }
                cancelLiveOrder(trader.id());
                trader.assign(due.assignment());
            }
        }

        if (!traders.isEmpty()) {
            Trader trader = traders.get(random.nextInt(traders.size()));
            Quote quote = decide(trader, view());
            if (quote != null) {
                cancelLiveOrder(trader.id());
                submitQuote(trader, quote);
            }
        }

        MarketView after = view();
        for (Trader trader : traders) {
            try {
                trader.respond(after);
            } catch (RuntimeException e) {
                skippedActions++;
                logger.error("Trader " + trader.id() + " failed to respond at tick " + tick, e);
            }
        }

        tick++;
        if (tick >= sessionLength) {
            close();
        }
    }

    private Quote decide(Trader trader, MarketView view) {
        try {
            return trader.decide(view);
        } catch (RuntimeException e) {
            skippedActions++;
            logger.error("Trader " + trader.id() + " skipped at tick " + tick, e);
            return null;
        }
    }

    private void submitQuote(Trader trader, Quote quote) {
        Order order = new Order(nextOrderId(), quote.side(), quote.price(), quote.quantity(), trader.id(), tick);
        SubmitResult result = route(order);
        if (!result.isAccepted()) {
            try {
                trader.onReject(quote, result.status());
            } catch (RuntimeException e) {
                logger.error("Trader " + trader.id() + " failed on reject", e);
            }
        }
    }

    /**
     * Submits an order directly, outside the trader loop. The order's trader
     * id, when it names a session trader, makes that trader the owner.
     *
     * @return {@link ValidationResult#SESSION_CLOSED} once the session has
     *         closed
     */
    public SubmitResult submit(Order order) {
        if (state == SessionState.CLOSED) {
            logger.warn("Order rejected, session closed", order.id());
            return SubmitResult.rejected(ValidationResult.SESSION_CLOSED);
        }
        if (tradersById.containsKey(order.traderId())) {
            cancelLiveOrder(order.traderId());
        }
        return route(order);
    }

    private SubmitResult route(Order order) {
        tape.appendQuote(tick, order);
        SubmitResult result = engine.submit(order);
        if (result.isAccepted() && result.restingQuantity() > 0 && tradersById.containsKey(order.traderId())) {
            liveOrders.put(order.traderId(), order.id());
        }
        return result;
    }

    private void cancelLiveOrder(String traderId) {
        long orderId = liveOrders.removeKey(traderId);
        if (orderId != NO_ORDER) {
            engine.cancel(orderId);
        }
    }

    /** Ids handed out by the session; direct submitters should use these too. */
    public long nextOrderId() {
        return ++nextOrderId;
    }

    public void requestStop() {
        stopRequested = true;
    }

    private void close() {
        state = SessionState.CLOSED;
        logger.log("Session " + sessionId + " closed, trades", engine.tradeCount());
        if (skippedActions > 0) {
            logger.warn("Session " + sessionId + " trader actions skipped", skippedActions);
        }
    }

    public MarketView view() {
        return new MarketView(tick, sessionLength, book.bestBid(), book.bestAsk(), book.levels(depth), lastTrade,
                minPrice, maxPrice);
    }

    /**
     * Profit per trader type, in {@link TraderType} declaration order, with
     * the current top of book.
     */
    public BalancesRecord balances() {
        Map<TraderType, long[]> totals = new EnumMap<>(TraderType.class);
        for (Trader trader : traders) {
            long[] total = totals.computeIfAbsent(trader.type(), t -> new long[2]);
            total[0] += trader.balance();
            total[1]++;
        }
        List<BalancesRecord.TypeBalance> balances = new ArrayList<>();
        for (Map.Entry<TraderType, long[]> entry : totals.entrySet()) {
            balances.add(new BalancesRecord.TypeBalance(entry.getKey(), entry.getValue()[0],
                    (int) entry.getValue()[1]));
        }
        return new BalancesRecord(sessionId, tick, balances, book.bestBid(), book.bestAsk());
    }

    public String sessionId() {
        return sessionId;
    }

    public SessionState state() {
        return state;
    }

    public long tick() {
        return tick;
    }

    public Tape tape() {
        return tape;
    }

    public OrderBook book() {
        return book;
    }

    public List<Trader> traders() {
        return Collections.unmodifiableList(traders);
    }

    public Trader trader(String id) {
        return tradersById.get(id);
    }

    /** Order id of the trader's resting quote, or 0. */
    public long liveOrder(String traderId) {
        return liveOrders.getValue(traderId);
    }

    public int skippedActions() {
        return skippedActions;
    }

    private final class SessionListener implements MatchEventListener {

        @Override
        public void onTrade(Trade trade) {
            lastTrade = trade;
            tape.appendTrade(tick, trade);
            notifyFill(trade, Side.BUY);
            notifyFill(trade, Side.SELL);
        }

        private void notifyFill(Trade trade, byte side) {
            String traderId = trade.traderId(side);
            if (traderId == null) {
                return;
            }
            long orderId = trade.orderId(side);
            if (liveOrders.getValue(traderId) == orderId && book.order(orderId) == null) {
                liveOrders.removeKey(traderId);
            }
            Trader trader = tradersById.get(traderId);
            if (trader == null) {
                return;
            }
            try {
                trader.onFill(trade, side);
            } catch (RuntimeException e) {
                logger.error("Trader " + traderId + " failed on fill " + trade.sequence(), e);
            }
        }

        @Override
        public void onOrderAccepted(Order order) {
        }

        @Override
        public void onOrderRejected(Order order, ValidationResult reason) {
            tape.appendReject(tick, order);
        }

        @Override
        public void onOrderCancelled(Order order) {
            tape.appendCancel(tick, order);
        }
    }
}
