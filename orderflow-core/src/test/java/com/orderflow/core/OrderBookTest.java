package com.orderflow.core;

import com.orderflow.core.logging.Logger;
import com.orderflow.core.logging.NullLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OrderBookTest {

    private OrderBook book;

    @BeforeEach
    void setUp() {
        book = new OrderBook(NullLogger.INSTANCE);
    }

    private static Order buy(long id, long price, long qty) {
        return new Order(id, Side.BUY, price, qty, "B" + id, id);
    }

    private static Order sell(long id, long price, long qty) {
        return new Order(id, Side.SELL, price, qty, "S" + id, id);
    }

    @Test
    void emptyBookReportsEmptyTopOfBook() {
        assertSame(TopOfBook.EMPTY, book.bestBid());
        assertSame(TopOfBook.EMPTY, book.bestAsk());
        assertTrue(book.isEmpty());
        assertEquals(0, book.revision());
    }

    @Test
    void bestPricesFollowSideOrdering() {
        book.insert(buy(1, 98, 1));
        book.insert(buy(2, 100, 2));
        book.insert(buy(3, 99, 3));
        book.insert(sell(4, 104, 4));
        book.insert(sell(5, 102, 5));

        assertEquals(100, book.bestBid().price());
        assertEquals(2, book.bestBid().quantity());
        assertEquals(102, book.bestAsk().price());
        assertEquals(5, book.bestAsk().quantity());
        assertEquals(3, book.depth(Side.BUY));
        assertEquals(2, book.depth(Side.SELL));
        assertEquals(5, book.orderCount());
    }

    @Test
    void levelsAggregateQuantityBestFirst() {
        book.insert(buy(1, 100, 3));
        book.insert(buy(2, 100, 4));
        book.insert(buy(3, 99, 1));
        book.insert(sell(4, 101, 2));

        LevelSnapshot snapshot = book.levels(5);

        assertEquals(2, snapshot.bidDepth());
        assertEquals(1, snapshot.askDepth());
        assertEquals(100, snapshot.bidPrice(0));
        assertEquals(7, snapshot.bidQuantity(0));
        assertEquals(99, snapshot.bidPrice(1));
        assertEquals(1, snapshot.bidQuantity(1));
        // past the resting depth
        assertEquals(0, snapshot.bidPrice(4));
        assertEquals(0, snapshot.askQuantity(3));
        assertEquals(book.revision(), snapshot.revision());
    }

    @Test
    void levelsTruncatesToRequestedDepth() {
        for (int i = 0; i < 6; i++) {
            book.insert(sell(i + 1, 110 + i, 1));
        }
        LevelSnapshot snapshot = book.levels(3);
        assertEquals(3, snapshot.askDepth());
        assertEquals(112, snapshot.askPrice(2));
    }

    @Test
    void levelsRejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> book.levels(0));
    }

    @Test
    void ordersAtTheSamePriceKeepArrivalOrder() {
        Order first = buy(1, 100, 5);
        Order second = buy(2, 100, 5);
        book.insert(first);
        book.insert(second);

        assertSame(first, book.bestLevel(Side.BUY).head());

        book.cancel(1);
        assertSame(second, book.bestLevel(Side.BUY).head());
    }

    @Test
    void rejectsMalformedOrders() {
        assertEquals(ValidationResult.INVALID_PRICE, book.insert(buy(1, 0, 5)));
        assertEquals(ValidationResult.INVALID_QUANTITY, book.insert(buy(2, 100, 0)));
        assertEquals(ValidationResult.UNKNOWN_SIDE, book.insert(new Order(3, (byte) 7, 100, 5, "X", 0)));
        assertEquals(ValidationResult.INVALID_ORDER_ID, book.insert(buy(0, 100, 5)));
        assertEquals(ValidationResult.INVALID_ORDER_ID, book.insert(buy(-4, 100, 5)));
        assertTrue(book.isEmpty());
        assertEquals(0, book.revision());
    }

    @Test
    void rejectsDuplicateId() {
        assertEquals(ValidationResult.VALID, book.insert(buy(1, 100, 5)));
        assertEquals(ValidationResult.DUPLICATE_ORDER_ID, book.insert(sell(1, 105, 5)));
        assertSame(TopOfBook.EMPTY, book.bestAsk());
    }

    @Test
    void refusesToRestAnOrderThatWouldCross() {
        book.insert(sell(1, 100, 5));

        assertEquals(ValidationResult.WOULD_CROSS, book.insert(buy(2, 100, 5)));
        assertEquals(ValidationResult.WOULD_CROSS, book.insert(buy(3, 101, 5)));
        assertEquals(ValidationResult.VALID, book.insert(buy(4, 99, 5)));
    }

    @Test
    void cancelRemovesOrderAndEmptyLevel() {
        book.insert(buy(1, 100, 5));
        book.insert(buy(2, 99, 5));
        long before = book.revision();

        assertTrue(book.cancel(1));

        assertEquals(99, book.bestBid().price());
        assertNull(book.order(1));
        assertEquals(1, book.depth(Side.BUY));
        assertEquals(before + 1, book.revision());
    }

    @Test
    void cancelOfUnknownIdIsLoggedAndChangesNothing() {
        Logger logger = mock(Logger.class);
        OrderBook logged = new OrderBook(logger);
        logged.insert(buy(1, 100, 5));
        LevelSnapshot before = logged.levels(3);

        assertFalse(logged.cancel(42));
        assertFalse(logged.cancel(42));

        assertEquals(before, logged.levels(3));
        verify(logger, times(2)).warn(eq("Cancel ignored, order not found"), eq(42L));
    }

    @Test
    void cancelOfAlreadyCancelledOrderReturnsFalse() {
        Logger logger = mock(Logger.class);
        OrderBook logged = new OrderBook(logger);
        logged.insert(sell(7, 100, 1));

        assertTrue(logged.cancel(7));
        verify(logger, never()).warn(eq("Cancel ignored, order not found"), anyLong());
        assertFalse(logged.cancel(7));
        verify(logger).warn(eq("Cancel ignored, order not found"), eq(7L));
    }

    @Test
    void revisionIsBumpedByEveryMutation() {
        book.insert(sell(1, 100, 5));
        assertEquals(1, book.revision());
        book.insert(buy(2, 99, 5));
        assertEquals(2, book.revision());
        book.fill(book.order(1), 2);
        assertEquals(3, book.revision());
        book.cancel(2);
        assertEquals(4, book.revision());
        book.insert(buy(3, 0, 5));
        assertEquals(4, book.revision());
    }

    @Test
    void partialFillKeepsOrderAtItsPosition() {
        Order resting = sell(1, 100, 10);
        book.insert(resting);
        book.insert(sell(2, 100, 3));

        book.fill(resting, 4);

        assertSame(resting, book.bestLevel(Side.SELL).head());
        assertEquals(6, resting.quantity());
        assertEquals(9, book.bestAsk().quantity());
        assertEquals(100, book.levels(1).askPrice(0));
    }
}
