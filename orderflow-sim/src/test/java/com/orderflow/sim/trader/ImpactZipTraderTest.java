package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.sim.MarketView;
import com.orderflow.sim.MarketViewFixture;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImpactZipTraderTest {

    private static final long LENGTH = 100;

    private static final ImpactParameters PARAMETERS = new ImpactParameters(1, 10, 0.6, 5.0, 0.8, 0.5, 0.3);

    private final MarketView quiet = new MarketViewFixture().bid(100, 1).ask(110, 1).view(0, LENGTH);
    // bid queue grows by 4: offset 5 around a mid of 105
    private final MarketView buyingPressure = new MarketViewFixture().bid(100, 5).ask(110, 1).view(0, LENGTH);

    private static ImpactZipTrader trader() {
        return new ImpactZipTrader("IZ", new Random(1), PARAMETERS);
    }

    @Test
    void isItsOwnVariant() {
        assertSame(TraderType.IMPACT_ZIP, trader().type());
        assertSame(TraderType.IMPACT_ZIP, TraderType.fromName("IZIP"));
        assertTrue(TraderType.IMPACT_ZIP.create("IZ", new Random(1), PARAMETERS) instanceof ImpactZipTrader);
    }

    @Test
    void withoutSignalQuotesLikeZip() {
        ImpactZipTrader trader = trader();
        trader.assign(new CustomerAssignment(Side.BUY, 100, 1, 0));
        trader.respond(quiet);

        assertFalse(trader.tracker().hasSignal());
        Quote quote = trader.decide(buyingPressure);
        assertEquals((long) Math.floor(100 * (1 + trader.marginBuy())), quote.price());
    }

    @Test
    void buyingPressureLiftsTheZipBid() {
        ImpactZipTrader trader = trader();
        trader.assign(new CustomerAssignment(Side.BUY, 100, 1, 0));
        trader.respond(quiet);
        trader.respond(buyingPressure);
        long zip = (long) Math.floor(100 * (1 + trader.marginBuy()));

        Quote quote = trader.decide(buyingPressure);

        assertEquals(Math.min(100, Math.round(zip + 0.5 * (105 + 5 - zip))), quote.price());
        assertTrue(quote.price() > zip);
        assertEquals(quote.price(), trader.currentPrice());
    }

    @Test
    void shiftedSellerNeverGoesBelowLimit() {
        ImpactZipTrader trader = trader();
        trader.assign(new CustomerAssignment(Side.SELL, 108, 1, 0));
        trader.respond(quiet);
        trader.respond(new MarketViewFixture().bid(100, 1).ask(110, 5).view(0, LENGTH));

        Quote quote = trader.decide(quiet);

        assertTrue(quote.price() >= 108, "quoted " + quote.price());
    }
}
