package com.quantbacktest.portfolio.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BacktestProperties constraint violations.
 */
class BacktestPropertiesValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    private static boolean hasViolationOn(Set<ConstraintViolation<BacktestProperties>> violations, String path) {
        return violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals(path));
    }

    @Test
    void testDefaults_NoViolations() {
        // Act
        Set<ConstraintViolation<BacktestProperties>> violations = validator.validate(new BacktestProperties());

        // Assert
        assertTrue(violations.isEmpty(), "Default properties should have no violations");
    }

    @Test
    void testNonPositiveCapital_Violation() {
        // Arrange
        BacktestProperties properties = new BacktestProperties();
        properties.setInitialCapital(0.0);

        // Act
        Set<ConstraintViolation<BacktestProperties>> violations = validator.validate(properties);

        // Assert
        assertTrue(hasViolationOn(violations, "initialCapital"));
    }

    @Test
    void testDownsizeFactorOutsideOpenInterval_Violation() {
        BacktestProperties one = new BacktestProperties();
        one.setDownsizeFactor(1.0);
        BacktestProperties zero = new BacktestProperties();
        zero.setDownsizeFactor(0.0);

        assertTrue(hasViolationOn(validator.validate(one), "downsizeFactor"));
        assertTrue(hasViolationOn(validator.validate(zero), "downsizeFactor"));
    }

    @Test
    void testShortHistory_Violation() {
        BacktestProperties properties = new BacktestProperties();
        properties.setMinHistoryBars(2);

        Set<ConstraintViolation<BacktestProperties>> violations = validator.validate(properties);

        assertEquals(1, violations.size());
        assertEquals("At least 3 bars of history are required", violations.iterator().next().getMessage());
    }

    @Test
    void testNestedSettings_Validated() {
        BacktestProperties properties = new BacktestProperties();
        properties.getTester().setEquityCheckSamples(0);
        properties.getLogBuffers().setBorrow(0);

        Set<ConstraintViolation<BacktestProperties>> violations = validator.validate(properties);

        assertTrue(hasViolationOn(violations, "tester.equityCheckSamples"));
        assertTrue(hasViolationOn(violations, "logBuffers.borrow"));
    }

    @Test
    void testMissingValuationMode_Violation() {
        BacktestProperties properties = new BacktestProperties();
        properties.setValuationMode(null);

        assertTrue(hasViolationOn(validator.validate(properties), "valuationMode"));
    }
}
