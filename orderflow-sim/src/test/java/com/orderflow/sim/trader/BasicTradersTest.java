package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.core.Trade;
import com.orderflow.sim.MarketView;
import com.orderflow.sim.MarketViewFixture;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.orderflow.sim.MarketViewFixture.MAX_PRICE;
import static com.orderflow.sim.MarketViewFixture.MIN_PRICE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BasicTradersTest {

    private static final MarketView OPEN_BOOK = new MarketViewFixture().bid(100, 2).ask(110, 2).view(0, 100);

    private static CustomerAssignment buy(long limit) {
        return new CustomerAssignment(Side.BUY, limit, 1, 0);
    }

    private static CustomerAssignment sell(long limit) {
        return new CustomerAssignment(Side.SELL, limit, 1, 0);
    }

    @Test
    void idleTraderStaysOut() {
        assertNull(new GiveawayTrader("G", new Random(1)).decide(OPEN_BOOK));
    }

    @Test
    void giveawayQuotesItsLimit() {
        GiveawayTrader trader = new GiveawayTrader("G", new Random(1));
        trader.assign(buy(120));
        assertEquals(new Quote(Side.BUY, 120, 1), trader.decide(OPEN_BOOK));

        trader.assign(sell(80));
        assertEquals(new Quote(Side.SELL, 80, 1), trader.decide(OPEN_BOOK));
    }

    @Test
    void fillBooksProfitAgainstLimitAndClearsAssignment() {
        GiveawayTrader trader = new GiveawayTrader("G", new Random(1));
        trader.assign(new CustomerAssignment(Side.BUY, 120, 2, 0));

        trader.onFill(new Trade(1, 105, 1, 1, 2, "G", "S", Side.SELL, 0), Side.BUY);
        assertEquals(15, trader.balance());
        assertEquals(1, trader.remaining());

        trader.onFill(new Trade(2, 110, 1, 1, 3, "G", "S", Side.SELL, 0), Side.BUY);
        assertEquals(25, trader.balance());
        assertEquals(2, trader.tradeCount());
        assertNull(trader.assignment());
        assertNull(trader.decide(OPEN_BOOK));
    }

    @Test
    void fillOnWrongSideIsIgnored() {
        GiveawayTrader trader = new GiveawayTrader("G", new Random(1));
        trader.assign(buy(120));

        trader.onFill(MarketViewFixture.trade(105, 1), Side.SELL);

        assertEquals(0, trader.balance());
        assertEquals(1, trader.remaining());
    }

    @Test
    void zeroIntelligenceNeverQuotesThroughItsLimit() {
        ZeroIntelligenceTrader trader = new ZeroIntelligenceTrader("Z", new Random(7));
        for (int i = 0; i < 1_000; i++) {
            trader.assign(buy(90));
            long bid = trader.decide(OPEN_BOOK).price();
            assertTrue(bid >= MIN_PRICE && bid <= 90, "bid " + bid);

            trader.assign(sell(90));
            long ask = trader.decide(OPEN_BOOK).price();
            assertTrue(ask >= 90 && ask <= MAX_PRICE, "ask " + ask);
        }
    }

    @Test
    void shaverImprovesBestByOneUpToLimit() {
        ShaverTrader trader = new ShaverTrader("H", new Random(1));

        trader.assign(buy(120));
        assertEquals(101, trader.decide(OPEN_BOOK).price());
        trader.assign(buy(100));
        assertEquals(100, trader.decide(OPEN_BOOK).price());

        trader.assign(sell(90));
        assertEquals(109, trader.decide(OPEN_BOOK).price());
        trader.assign(sell(110));
        assertEquals(110, trader.decide(OPEN_BOOK).price());
    }

    @Test
    void shaverStubsEmptySideAtSystemBound() {
        ShaverTrader trader = new ShaverTrader("H", new Random(1));
        MarketView empty = MarketViewFixture.empty(0, 100);

        trader.assign(buy(120));
        assertEquals(MIN_PRICE, trader.decide(empty).price());
        trader.assign(sell(90));
        assertEquals(MAX_PRICE, trader.decide(empty).price());
    }

    @Test
    void sniperLurksUntilTheClose() {
        SniperTrader trader = new SniperTrader("N", new Random(1));
        trader.assign(buy(120));
        MarketViewFixture book = new MarketViewFixture().bid(100, 2).ask(110, 2);

        assertNull(trader.decide(book.view(0, 1000)));
        assertNull(trader.decide(book.view(799, 1000)));
        // countdown 0.1: shave 5
        assertEquals(105, trader.decide(book.view(900, 1000)).price());
        // shave 100 would pass the limit
        assertEquals(120, trader.decide(book.view(1000, 1000)).price());
    }

    @Test
    void sniperShaveGrowsAsTimeRunsOut() {
        assertEquals(2, SniperTrader.shave(0.2));
        assertEquals(5, SniperTrader.shave(0.1));
        assertEquals(100, SniperTrader.shave(0.0));
    }

    @Test
    void traderTypesResolveByNameOrCode() {
        assertSame(TraderType.GIVEAWAY, TraderType.fromName("gvwy"));
        assertSame(TraderType.IMPACT_SENSITIVE_FILTERED, TraderType.fromName("ISHVF"));
        assertSame(TraderType.ZERO_INTELLIGENCE, TraderType.fromName("zero_intelligence"));
        assertThrows(IllegalArgumentException.class, () -> TraderType.fromName("AA"));
    }

    @Test
    void everyTypeBuildsItsOwnTrader() {
        for (TraderType type : TraderType.values()) {
            Trader trader = type.create("T", new Random(3), ImpactParameters.DEFAULTS);
            assertSame(type, trader.type());
            assertEquals("T", trader.id());
        }
    }

    @Test
    void assignmentRejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> new CustomerAssignment((byte) 5, 100, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new CustomerAssignment(Side.BUY, 0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new CustomerAssignment(Side.SELL, 100, 0, 0));
    }
}
