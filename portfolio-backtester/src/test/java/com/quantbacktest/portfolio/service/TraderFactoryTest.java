package com.quantbacktest.portfolio.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.portfolio.domain.FixedDirectionTrader;
import com.quantbacktest.portfolio.domain.SignalTrader;
import com.quantbacktest.portfolio.domain.Trader;
import com.quantbacktest.portfolio.domain.TraderHyperparameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TraderFactory.
 */
class TraderFactoryTest {

    private TraderFactory traderFactory;

    @BeforeEach
    void setUp() {
        traderFactory = new TraderFactory(new ObjectMapper());
    }

    @Test
    void testCreateSignalTrader_ParsesHyperparameters() {
        // Act
        Trader trader = traderFactory.createTrader("SIGNAL",
                "{\"confirmDays\": 3, \"enableShort\": false, \"macdSignalMode\": \"cross\"}");

        // Assert
        SignalTrader signalTrader = assertInstanceOf(SignalTrader.class, trader);
        TraderHyperparameters hp = signalTrader.getHyperparameters();
        assertEquals(3, hp.getConfirmDays());
        assertFalse(hp.isEnableShort());
        assertEquals(TraderHyperparameters.MacdSignalMode.CROSS, hp.getMacdSignalMode());
        // untouched fields keep their defaults
        assertEquals(3, hp.getMinHoldDays());
        assertEquals(1.0, trader.getEquity());
    }

    @Test
    void testCreateFixedDirectionTraders() {
        FixedDirectionTrader longTrader = assertInstanceOf(FixedDirectionTrader.class,
                traderFactory.createTrader("buy_and_hold", null));
        FixedDirectionTrader shortTrader = assertInstanceOf(FixedDirectionTrader.class,
                traderFactory.createTrader("fixed_short", null));

        assertEquals(1, longTrader.getDirection());
        assertEquals(-1, shortTrader.getDirection());
    }

    @Test
    void testUnknownTrader_DefaultsToSignalTrader() {
        assertInstanceOf(SignalTrader.class, traderFactory.createTrader("momentum", "{}"));
        assertInstanceOf(SignalTrader.class, traderFactory.createTrader(null, null));
    }

    @Test
    void testParseHyperparameters_UnknownFieldsIgnored() {
        TraderHyperparameters hp = traderFactory.parseHyperparameters(
                "{\"atrEnterK\": 0.5, \"legacyField\": true, \"prevCloseReference\": \"week\"}");

        assertEquals(0.5, hp.getAtrEnterK());
        assertEquals(TraderHyperparameters.PrevCloseReference.FAST, hp.getPrevCloseReference());
    }

    @Test
    void testParseHyperparameters_OutOfRangeValuesNormalized() {
        TraderHyperparameters hp = traderFactory.parseHyperparameters("{\"confirmDays\": 0, \"macdSizeMin\": 2.0}");

        assertEquals(1, hp.getConfirmDays());
        assertEquals(1.0, hp.getMacdSizeMin());
    }

    @Test
    void testParseHyperparameters_InvalidJson_ReturnsDefaults() {
        assertEquals(TraderHyperparameters.defaults(), traderFactory.parseHyperparameters("{not json"));
        assertEquals(TraderHyperparameters.defaults(), traderFactory.parseHyperparameters("  "));
    }
}
