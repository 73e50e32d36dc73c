package com.quantbacktest.portfolio.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ListBarFeed.
 */
class ListBarFeedTest {

    @Test
    void testIndexOf() {
        BarFeed feed = SyntheticBars.feed("AAA", SyntheticBars.flat(SyntheticBars.START, 5, 100.0));

        assertEquals(5, feed.size());
        assertEquals(0, feed.indexOf(SyntheticBars.START));
        // Jan 6 2024 is a Saturday
        assertEquals(-1, feed.indexOf(LocalDate.of(2024, 1, 6)));
        assertEquals(4, feed.indexOf(LocalDate.of(2024, 1, 5)));
        assertEquals(LocalDate.of(2024, 1, 5), feed.lastDate());
    }

    @Test
    void testPreviousContext_UsesPriorBar() {
        List<Bar> bars = SyntheticBars.fromOpens(SyntheticBars.START, 100, 101, 102, 103);
        BarFeed feed = SyntheticBars.feed("AAA", bars);

        SignalContext context = feed.previousContext(3);

        assertTrue(context.isValid());
        assertEquals(bars.get(3).getDate(), context.getDate());
        assertEquals(102.0, context.closePrev());
    }

    @Test
    void testPreviousContext_InvalidBeforeTwoBars() {
        BarFeed feed = SyntheticBars.feed("AAA", SyntheticBars.flat(SyntheticBars.START, 4, 100.0));

        assertFalse(feed.previousContext(1).isValid());
        assertFalse(feed.previousContext(4).isValid());
    }

    @Test
    void testUnorderedBars_Throw() {
        List<Bar> bars = SyntheticBars.flat(SyntheticBars.START, 3, 100.0);
        List<Bar> reversed = List.of(bars.get(1), bars.get(0));

        assertThrows(IllegalArgumentException.class, () -> new ListBarFeed("AAA", reversed));
        assertThrows(IllegalArgumentException.class, () -> new ListBarFeed("", bars));
    }
}
