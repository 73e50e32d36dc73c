package com.quantbacktest.portfolio.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.portfolio.domain.FixedDirectionTrader;
import com.quantbacktest.portfolio.domain.SignalTrader;
import com.quantbacktest.portfolio.domain.Trader;
import com.quantbacktest.portfolio.domain.TraderHyperparameters;
import com.quantbacktest.portfolio.domain.cost.NullSignalCostModel;
import com.quantbacktest.portfolio.domain.cost.SignalCostModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Factory for creating trader instances based on name and parameters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TraderFactory {

    private final ObjectMapper objectMapper;

    /**
     * Create a trader for the engine. Under the engine the ledger owns all costs,
     * so the trader's own notional accounting runs cost-free.
     */
    public Trader createTrader(String traderName, String parametersJson) {
        return createTrader(traderName, parametersJson, NullSignalCostModel.INSTANCE, 1.0);
    }

    /**
     * Create a trader instance from name and JSON hyperparameters.
     */
    public Trader createTrader(String traderName, String parametersJson, SignalCostModel costModel,
                               double initialEquity) {
        log.info("Creating trader: {} with parameters: {}", traderName, parametersJson);
        String name = traderName != null ? traderName.toLowerCase(Locale.ROOT) : "";

        return switch (name) {
            case "signal", "signaltrader", "ma_stack" ->
                    new SignalTrader("SignalTrader", initialEquity, costModel, parseHyperparameters(parametersJson));

            case "buyandhold", "buy_and_hold", "long" -> FixedDirectionTrader.buyAndHold(initialEquity, costModel);

            case "short", "fixed_short" -> new FixedDirectionTrader("FixedShort", initialEquity, costModel, -1);

            default -> {
                log.warn("Unknown trader: {}, defaulting to SignalTrader", traderName);
                yield new SignalTrader("SignalTrader", initialEquity, costModel, parseHyperparameters(parametersJson));
            }
        };
    }

    /**
     * Parse hyperparameters; missing fields keep their defaults and unparseable input gives all defaults.
     */
    public TraderHyperparameters parseHyperparameters(String parametersJson) {
        if (parametersJson == null || parametersJson.isBlank()) {
            log.debug("No hyperparameters provided, using defaults");
            return TraderHyperparameters.defaults();
        }

        try {
            return objectMapper.readerFor(TraderHyperparameters.class)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .<TraderHyperparameters>readValue(parametersJson)
                    .normalized();
        } catch (Exception e) {
            log.error("Failed to parse trader hyperparameters, using defaults: {}", e.getMessage());
            return TraderHyperparameters.defaults();
        }
    }
}
