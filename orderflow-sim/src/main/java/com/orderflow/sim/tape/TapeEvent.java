package com.orderflow.sim.tape;

import com.lmax.disruptor.EventFactory;

/**
 * Ring buffer slot carrying one tape entry to the journal thread.
 */
public class TapeEvent {
    public TapeEntry entry;

    public void reset() {
        entry = null;
    }

    public final static EventFactory<TapeEvent> FACTORY = TapeEvent::new;
}
