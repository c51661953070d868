package com.tekir.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or the quota tiers are out of order.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "tekir.quota.anonymous-daily-limit",
            "tekir.quota.authenticated-daily-limit",
            "tekir.quota.paid-daily-limit"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        Integer anonymous = readInt("tekir.quota.anonymous-daily-limit", problems);
        Integer authenticated = readInt("tekir.quota.authenticated-daily-limit", problems);
        Integer paid = readInt("tekir.quota.paid-daily-limit", problems);
        if (anonymous != null && authenticated != null && paid != null) {
            if (anonymous < 1) {
                problems.add("tekir.quota.anonymous-daily-limit: must be positive");
            }
            if (anonymous > authenticated || authenticated > paid) {
                problems.add("tekir.quota.*-daily-limit: expected anonymous <= authenticated <= paid");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }

        log.info("Configuration validated (quota tiers {}/{}/{})", anonymous, authenticated, paid);
    }

    private Integer readInt(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            problems.add(key + ": must be a number");
            return null;
        }
    }
}
