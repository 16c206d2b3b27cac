package com.stagedsignal.backtester.service;

import com.stagedsignal.backtester.domain.BreakoutWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ProfileValidator.
 */
class ProfileValidatorTest {

    private static ProfileValidator profileValidator;

    @BeforeAll
    static void setUp() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        profileValidator = new ProfileValidator(validator);
    }

    @Test
    void testDefaults_AreValid() {
        List<String> errors = profileValidator.validate(StrategyProfile.defaults("default"));

        assertTrue(errors.isEmpty(), "Default profile should be valid, got " + errors);
    }

    @Test
    void testMissingProfile() {
        List<String> errors = profileValidator.validate(null);

        assertEquals(List.of("profile is missing"), errors);
    }

    @Test
    void testRelativeStrengthThreshold_AboveHundred() {
        StrategyProfile profile = StrategyProfile.defaults("p");
        profile.getRelativeStrength().setThreshold(new BigDecimal("101"));

        List<String> errors = profileValidator.validate(profile);

        assertEquals(1, errors.size(), "Expected one error, got " + errors);
        assertTrue(errors.get(0).startsWith("relativeStrength.threshold"),
                "Error should name the property path");
    }

    @Test
    void testMarketCapRange_Inverted() {
        StrategyProfile profile = StrategyProfile.defaults("p");
        profile.getFundamental().setMinMarketCap(new BigDecimal("5000000000"));
        profile.getFundamental().setMaxMarketCap(new BigDecimal("1000000000"));

        List<String> errors = profileValidator.validate(profile);

        assertEquals(List.of("fundamental.minMarketCap must not exceed fundamental.maxMarketCap"), errors);
    }

    @Test
    void testBreakoutWindows_Duplicate() {
        StrategyProfile profile = StrategyProfile.defaults("p");
        profile.getDaily().setBreakoutWindows(new ArrayList<>(List.of(
                BreakoutWindow.ONE_MONTH, BreakoutWindow.THREE_MONTH, BreakoutWindow.ONE_MONTH)));

        List<String> errors = profileValidator.validate(profile);

        assertEquals(List.of("daily.breakoutWindows lists ONE_MONTH more than once"), errors);
    }

    @Test
    void testBreakoutWindows_Empty() {
        StrategyProfile profile = StrategyProfile.defaults("p");
        profile.getDaily().setBreakoutWindows(new ArrayList<>());

        List<String> errors = profileValidator.validate(profile);

        assertEquals(1, errors.size(), "Expected one error, got " + errors);
        assertTrue(errors.get(0).startsWith("daily.breakoutWindows"));
    }

    @Test
    void testAdrThresholds_Inverted() {
        StrategyProfile profile = StrategyProfile.defaults("p");
        profile.getExecution().setLowAdrThreshold(new BigDecimal("6"));

        List<String> errors = profileValidator.validate(profile);

        assertEquals(List.of("execution.lowAdrThreshold must not exceed execution.highAdrThreshold"), errors);
    }

    @Test
    void testSeveralProblems_AllReported() {
        StrategyProfile profile = StrategyProfile.defaults("p");
        profile.getExecution().setMaxPositions(0);
        profile.getWeekly().setCloseLag(3);
        profile.getExecution().setLowAdrThreshold(new BigDecimal("6"));

        List<String> errors = profileValidator.validate(profile);

        assertEquals(3, errors.size(), "Expected three errors, got " + errors);
        assertTrue(errors.get(0).startsWith("execution.maxPositions"), "Field errors are sorted by path");
        assertTrue(errors.get(1).startsWith("weekly.closeLag"));
        assertEquals("execution.lowAdrThreshold must not exceed execution.highAdrThreshold", errors.get(2));
    }
}
