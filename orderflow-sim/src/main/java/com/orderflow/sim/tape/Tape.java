package com.orderflow.sim.tape;

import com.orderflow.core.Order;
import com.orderflow.core.Trade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of everything that happened in one session, ordered by
 * tick and then by sequence. Owned by the session thread; hand
 * {@link #entries()} to other threads only after the session has closed.
 */
public class Tape {

    private final String sessionId;
    private final List<TapeEntry> entries = new ArrayList<>();
    private long lastTick = Long.MIN_VALUE;

    public Tape(String sessionId) {
        this.sessionId = sessionId;
    }

    public TapeEntry appendQuote(long tick, Order order) {
        return append(TapeEntry.ofOrder(sessionId, nextSequence(), checkTick(tick), TapeEntry.Kind.QUOTE, order));
    }

    public TapeEntry appendTrade(long tick, Trade trade) {
        return append(TapeEntry.ofTrade(sessionId, nextSequence(), checkTick(tick), trade));
    }

    public TapeEntry appendCancel(long tick, Order order) {
        return append(TapeEntry.ofOrder(sessionId, nextSequence(), checkTick(tick), TapeEntry.Kind.CANCEL, order));
    }

    public TapeEntry appendReject(long tick, Order order) {
        return append(TapeEntry.ofOrder(sessionId, nextSequence(), checkTick(tick), TapeEntry.Kind.REJECT, order));
    }

    private TapeEntry append(TapeEntry entry) {
        entries.add(entry);
        return entry;
    }

    private long nextSequence() {
        return entries.size() + 1L;
    }

    private long checkTick(long tick) {
        if (tick < lastTick) {
            throw new IllegalStateException("Tape of " + sessionId + " is at tick " + lastTick + ", cannot append "
                    + tick);
        }
        lastTick = tick;
        return tick;
    }

    public String sessionId() {
        return sessionId;
    }

    public List<TapeEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<TapeEntry> trades() {
        List<TapeEntry> trades = new ArrayList<>();
        for (TapeEntry entry : entries) {
            if (entry.kind() == TapeEntry.Kind.TRADE) {
                trades.add(entry);
            }
        }
        return trades;
    }

    public int size() {
        return entries.size();
    }
}
