package com.orderflow.sim;

import com.orderflow.core.TopOfBook;
import com.orderflow.sim.trader.TraderType;

import java.util.Collections;
import java.util.List;

/**
 * Per-type profit of one session at one tick, plus the top of book at that
 * moment. One of these per trading day is what the balances file holds.
 */
public final class BalancesRecord {

    /** Aggregate over all traders of one type. */
    public static final class TypeBalance {
        private final TraderType type;
        private final long balanceSum;
        private final int count;

        public TypeBalance(TraderType type, long balanceSum, int count) {
            this.type = type;
            this.balanceSum = balanceSum;
            this.count = count;
        }

        public TraderType type() {
            return type;
        }

        public long balanceSum() {
            return balanceSum;
        }

        public int count() {
            return count;
        }

        public double average() {
            return count == 0 ? 0 : (double) balanceSum / count;
        }

        @Override
        public String toString() {
            return type.code() + "{sum=" + balanceSum + ", n=" + count + '}';
        }
    }

    private final String sessionId;
    private final long tick;
    private final List<TypeBalance> balances;
    private final TopOfBook bestBid;
    private final TopOfBook bestAsk;

    public BalancesRecord(String sessionId, long tick, List<TypeBalance> balances, TopOfBook bestBid,
            TopOfBook bestAsk) {
        this.sessionId = sessionId;
        this.tick = tick;
        this.balances = Collections.unmodifiableList(balances);
        this.bestBid = bestBid;
        this.bestAsk = bestAsk;
    }

    public String sessionId() {
        return sessionId;
    }

    public long tick() {
        return tick;
    }

    public List<TypeBalance> balances() {
        return balances;
    }

    /** The aggregate for one type, or null when the population has none. */
    public TypeBalance balance(TraderType type) {
        for (TypeBalance balance : balances) {
            if (balance.type() == type) {
                return balance;
            }
        }
        return null;
    }

    public TopOfBook bestBid() {
        return bestBid;
    }

    public TopOfBook bestAsk() {
        return bestAsk;
    }

    @Override
    public String toString() {
        return "BalancesRecord{" + sessionId + " t=" + tick + " " + balances + '}';
    }
}
