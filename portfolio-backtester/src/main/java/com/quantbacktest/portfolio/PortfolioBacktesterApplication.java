package com.quantbacktest.portfolio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the shared-cash portfolio backtester.
 */
@SpringBootApplication
public class PortfolioBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioBacktesterApplication.class, args);
    }

}
