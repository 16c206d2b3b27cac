package com.stagedsignal.backtester.service;

import com.stagedsignal.backtester.config.BacktestProperties;
import com.stagedsignal.backtester.domain.StrategyProfile;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Named strategy profiles from configuration, validated once at startup.
 * When no profile is configured under the default name, that name maps to the built-in defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileRegistry {

    private final BacktestProperties properties;
    private final ProfileValidator profileValidator;

    private final Map<String, StrategyProfile> profiles = new TreeMap<>();

    @PostConstruct
    public void loadProfiles() {
        List<String> errors = new ArrayList<>();

        properties.getProfiles().forEach((name, profile) -> {
            if (profile != null && profile.getName() == null) {
                profile.setName(name);
            }
            profileValidator.validate(profile).forEach(error -> errors.add(name + ": " + error));
            profiles.put(name, profile);
        });
        profiles.computeIfAbsent(properties.getDefaultProfile(), StrategyProfile::defaults);

        if (!errors.isEmpty()) {
            errors.forEach(error -> log.error("Invalid profile setting - {}", error));
            throw new IllegalStateException("Invalid strategy profiles: " + String.join("; ", errors));
        }

        log.info("Loaded strategy profiles: {} (default: {})", profiles.keySet(), properties.getDefaultProfile());
    }

    /**
     * @param name profile name, or null for the default profile
     * @throws IllegalArgumentException when no profile has that name
     */
    public StrategyProfile profile(String name) {
        String key = name == null || name.isBlank() ? properties.getDefaultProfile() : name;
        StrategyProfile profile = profiles.get(key);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown strategy profile: " + key + ", available: " + profiles.keySet());
        }
        return profile;
    }

    public Map<String, StrategyProfile> getProfiles() {
        return Collections.unmodifiableMap(profiles);
    }
}
