package com.quantbacktest.portfolio.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TraderHyperparameters normalization.
 */
class TraderHyperparametersTest {

    @Test
    void testDefaults() {
        TraderHyperparameters hp = TraderHyperparameters.defaults();

        assertEquals(2, hp.getConfirmDays());
        assertEquals(3, hp.getMinHoldDays());
        assertTrue(hp.isUseLongTrendFilter());
        assertFalse(hp.isUseShortTrendFilter());
        assertEquals(TraderHyperparameters.MacdSignalMode.HISTOGRAM, hp.getMacdSignalMode());
        assertEquals(hp, hp.normalized());
    }

    @Test
    void testNormalized_ClampsOutOfRangeValues() {
        TraderHyperparameters hp = TraderHyperparameters.builder()
                .confirmDays(0)
                .minHoldDays(-2)
                .cooldownDays(-1)
                .atrEnterK(-0.5)
                .spreadExitPct(Double.NaN)
                .macdSizeAtrK(0.0)
                .build()
                .normalized();

        assertEquals(1, hp.getConfirmDays());
        assertEquals(0, hp.getMinHoldDays());
        assertEquals(0, hp.getCooldownDays());
        assertEquals(0.0, hp.getAtrEnterK());
        assertEquals(0.0, hp.getSpreadExitPct());
        assertEquals(0.5, hp.getMacdSizeAtrK());
    }

    @Test
    void testNormalized_SwapsInvertedSizeBounds() {
        TraderHyperparameters hp = TraderHyperparameters.builder()
                .macdSizeMin(0.9)
                .macdSizeMax(1.5)
                .build();
        TraderHyperparameters inverted = hp.toBuilder().macdSizeMin(0.8).macdSizeMax(0.3).build().normalized();

        assertEquals(1.0, hp.normalized().getMacdSizeMax());
        assertEquals(0.3, inverted.getMacdSizeMin());
        assertEquals(0.8, inverted.getMacdSizeMax());
    }

    @Test
    void testEnumAliases() {
        assertEquals(TraderHyperparameters.MacdSignalMode.CROSS, TraderHyperparameters.MacdSignalMode.from(" cross "));
        assertEquals(TraderHyperparameters.MacdSignalMode.HISTOGRAM, TraderHyperparameters.MacdSignalMode.from("hist"));
        assertEquals(TraderHyperparameters.PrevCloseReference.FAST, TraderHyperparameters.PrevCloseReference.from("week"));
        assertEquals(TraderHyperparameters.PrevCloseReference.MID, TraderHyperparameters.PrevCloseReference.from(null));
    }
}
