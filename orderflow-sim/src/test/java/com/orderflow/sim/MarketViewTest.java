package com.orderflow.sim;

import com.orderflow.core.Side;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketViewTest {

    @Test
    void countdownRunsFromOneToZero() {
        assertEquals(1.0, MarketViewFixture.empty(0, 200).countdown());
        assertEquals(0.25, MarketViewFixture.empty(150, 200).countdown());
        assertEquals(0.0, MarketViewFixture.empty(200, 200).countdown());
    }

    @Test
    void midPriceAndBestBySide() {
        MarketView view = new MarketViewFixture().bid(100, 3).ask(110, 1).view(0, 10);

        assertTrue(view.hasMidPrice());
        assertEquals(105.0, view.midPrice());
        assertEquals(100, view.best(Side.BUY).price());
        assertEquals(110, view.best(Side.SELL).price());
    }

    @Test
    void oneSidedBookHasNoMid() {
        MarketView view = new MarketViewFixture().bid(100, 3).view(0, 10);

        assertFalse(view.hasMidPrice());
        assertTrue(view.bestAsk().isEmpty());
    }
}
