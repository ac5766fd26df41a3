package com.accessgate.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.accessgate.backend.modules.auth.application.TokenExpiryParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-in-production-change-me-in-production";
    private static final int MIN_SECRET_BYTES = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        Optional<String> jwtSecret = property("jwt.secret");
        if (jwtSecret.isEmpty()) {
            problems.add("jwt.secret is required");
        } else if (jwtSecret.get().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add("jwt.secret must be at least 32 bytes");
        } else if (jwtSecret.get().equals(PLACEHOLDER_SECRET) && isProductionProfile()) {
            problems.add("jwt.secret still has the placeholder value");
        }

        for (String key : List.of("jwt.access-token-expiry", "jwt.refresh-token-expiry")) {
            property(key)
                    .filter(value -> !TokenExpiryParser.isValid(value))
                    .ifPresent(value -> problems.add(key + " has an unsupported format: " + value));
        }

        return problems;
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private boolean isProductionProfile() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equals(profile)) {
                return true;
            }
        }
        return false;
    }
}
