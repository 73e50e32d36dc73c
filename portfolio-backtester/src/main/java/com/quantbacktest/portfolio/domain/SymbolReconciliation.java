package com.quantbacktest.portfolio.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Trader-versus-ledger comparison for one symbol.
 */
@Value
@Builder
public class SymbolReconciliation {
    String symbol;
    String traderId;
    int traderFills;
    int ledgerTrades;
    int rejections;
    /** Trader fill dates with neither a ledger trade nor a rejection. */
    int missingInLedger;
    /** Ledger trade dates with no trader fill. */
    int missingInTrader;
    boolean finalPositionMatch;
}
