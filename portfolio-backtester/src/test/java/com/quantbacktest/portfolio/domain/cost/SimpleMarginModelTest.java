package com.quantbacktest.portfolio.domain.cost;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SimpleMarginModel.
 */
class SimpleMarginModelTest {

    @Test
    void testDefault_LongsReserveNothing() {
        assertEquals(0.0, SimpleMarginModel.DEFAULT.margin(10, 100.0, 1.0));
    }

    @Test
    void testDefault_ShortsReserveHalfOfNotional() {
        assertEquals(500.0, SimpleMarginModel.DEFAULT.margin(-10, 100.0, 1.0), 1e-12);
        assertEquals(5000.0, SimpleMarginModel.DEFAULT.margin(-10, 100.0, 10.0), 1e-9);
    }

    @Test
    void testNonFiniteInputs_NoMargin() {
        assertEquals(0.0, SimpleMarginModel.DEFAULT.margin(-10, Double.NaN, 1.0));
        assertEquals(0.0, SimpleMarginModel.DEFAULT.margin(Double.NEGATIVE_INFINITY, 100.0, 1.0));
    }

    @Test
    void testLongRate_Applied() {
        SimpleMarginModel model = new SimpleMarginModel(0.2, 0.5, 0.3);

        assertEquals(200.0, model.margin(10, 100.0, 1.0), 1e-12);
        assertEquals(0.0, SimpleMarginModel.NONE.margin(-10, 100.0, 1.0));
    }
}
