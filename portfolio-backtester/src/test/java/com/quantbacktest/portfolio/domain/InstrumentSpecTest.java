package com.quantbacktest.portfolio.domain;

import com.quantbacktest.portfolio.domain.cost.CalendarYearTaxModel;
import com.quantbacktest.portfolio.domain.cost.RateFeeModel;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InstrumentSpec defaults and cost delegation.
 */
class InstrumentSpecTest {

    @Test
    void testDefaults() {
        InstrumentSpec spec = InstrumentSpec.builder().symbol("AAA").build();

        assertEquals(1.0, spec.getMultiplier());
        assertTrue(spec.isAllowShort());
        assertEquals(1.0, spec.getMaxNotionalFraction());
        assertEquals(0.04, spec.getBorrowRateAnnual());
        assertEquals("UNKNOWN", spec.getAssetType());
        assertFalse(spec.hasShortDeadline());
        assertEquals(0.0, spec.fee(1000.0));
    }

    @Test
    void testKrxAssetType_EnforcesNinetyDayShortLimit() {
        InstrumentSpec spec = InstrumentSpec.builder().symbol("005930").assetType("KRX_STOCK").build();

        assertTrue(spec.hasShortDeadline());
        assertEquals(InstrumentSpec.KRX_SHORT_MAX_HOLD_DAYS, spec.getShortMaxHoldDays());
    }

    @Test
    void testKrxTagInName_TreatedAsAssetType() {
        InstrumentSpec spec = InstrumentSpec.builder().symbol("005930").name("krx_stock").build();

        assertEquals("KRX_STOCK", spec.getAssetType());
        assertTrue(spec.hasShortDeadline());
    }

    @Test
    void testExplicitShortRule_OverridesKrxDefault() {
        InstrumentSpec spec = InstrumentSpec.builder()
                .symbol("005930")
                .assetType("KRX_STOCK")
                .enforceShortMaxHold(false)
                .build();

        assertFalse(spec.hasShortDeadline());
    }

    @Test
    void testMissingSymbol_Throws() {
        assertThrows(IllegalArgumentException.class, () -> InstrumentSpec.builder().build());
        assertThrows(IllegalArgumentException.class, () -> InstrumentSpec.builder().symbol(" ").build());
    }

    @Test
    void testCostDelegation() {
        InstrumentSpec spec = InstrumentSpec.builder()
                .symbol("AAA")
                .multiplier(10.0)
                .feeModel(RateFeeModel.ofRate(0.001))
                .taxModel(CalendarYearTaxModel.flat(0.002))
                .build();

        assertEquals(1.0, spec.fee(1000.0), 1e-12);
        assertEquals(2.0, spec.tax(LocalDate.of(2024, 1, 2), TradeSide.SELL, 1000.0), 1e-12);
        // short 3 contracts at 100 x 10: half of 3000 reserved
        assertEquals(1500.0, spec.requiredMargin(-3, 100.0), 1e-9);
    }
}
