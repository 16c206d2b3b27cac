package com.stagedsignal.backtester.service;

import com.stagedsignal.backtester.domain.BreakoutWindow;
import com.stagedsignal.backtester.domain.StrategyProfile;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a profile's field constraints and the rules that span several fields.
 */
@Component
@RequiredArgsConstructor
public class ProfileValidator {

    private final Validator validator;

    /**
     * @return one message per problem, empty when the profile is usable
     */
    public List<String> validate(StrategyProfile profile) {
        List<String> errors = new ArrayList<>();
        if (profile == null) {
            errors.add("profile is missing");
            return errors;
        }

        validator.validate(profile).stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .forEach(violation -> errors.add(describe(violation)));

        StrategyProfile.FundamentalSettings fundamental = profile.getFundamental();
        if (fundamental != null && fundamental.getMinMarketCap() != null && fundamental.getMaxMarketCap() != null
                && fundamental.getMinMarketCap().compareTo(fundamental.getMaxMarketCap()) > 0) {
            errors.add("fundamental.minMarketCap must not exceed fundamental.maxMarketCap");
        }

        StrategyProfile.DailySettings daily = profile.getDaily();
        if (daily != null && daily.getBreakoutWindows() != null) {
            Set<BreakoutWindow> seen = EnumSet.noneOf(BreakoutWindow.class);
            for (BreakoutWindow window : daily.getBreakoutWindows()) {
                if (window == null) {
                    errors.add("daily.breakoutWindows must not contain empty entries");
                } else if (!seen.add(window)) {
                    errors.add("daily.breakoutWindows lists " + window + " more than once");
                }
            }
        }

        StrategyProfile.ExecutionSettings execution = profile.getExecution();
        if (execution != null && execution.getLowAdrThreshold() != null && execution.getHighAdrThreshold() != null
                && execution.getLowAdrThreshold().compareTo(execution.getHighAdrThreshold()) > 0) {
            errors.add("execution.lowAdrThreshold must not exceed execution.highAdrThreshold");
        }
        return errors;
    }

    private String describe(ConstraintViolation<StrategyProfile> violation) {
        return violation.getPropertyPath() + " " + violation.getMessage();
    }
}
