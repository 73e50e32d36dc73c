package com.quantbacktest.portfolio.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BufferedLog.
 */
class BufferedLogTest {

    @Test
    void testAppend_FlushesWhenBufferFills() {
        BufferedLog<String> log = new BufferedLog<>(3);

        log.append("a");
        log.append("b");
        assertEquals(2, log.pendingCount());
        assertEquals(2, log.size());

        log.append("c");
        assertEquals(0, log.pendingCount());
        assertEquals(3, log.size());
    }

    @Test
    void testEntries_FlushesPendingRowsInOrder() {
        BufferedLog<String> log = new BufferedLog<>(10);
        log.append("first");
        log.append("second");

        List<String> entries = log.entries();

        assertEquals(List.of("first", "second"), entries);
        assertEquals(0, log.pendingCount());
        assertThrows(UnsupportedOperationException.class, () -> entries.add("third"));
    }

    @Test
    void testNonPositiveBufferSize_TreatedAsOne() {
        BufferedLog<Integer> log = new BufferedLog<>(0);

        log.append(1);

        assertEquals(0, log.pendingCount());
        assertFalse(log.isEmpty());
    }

    @Test
    void testClear() {
        BufferedLog<Integer> log = new BufferedLog<>(2);
        log.append(1);
        log.append(2);
        log.append(3);

        log.clear();

        assertTrue(log.isEmpty());
        assertTrue(log.entries().isEmpty());
    }
}
