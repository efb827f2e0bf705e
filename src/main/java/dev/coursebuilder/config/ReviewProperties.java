package dev.coursebuilder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Review policy. defaultMinimumReviews applies to units without their own entry;
 * writeAttempts bounds the read-modify-write retry on a work record.
 */
@ConfigurationProperties(prefix = "coursebuilder.review")
public record ReviewProperties(int defaultMinimumReviews, int writeAttempts, Duration writeBackoff,
                               Map<String, UnitPolicy> units) {
    public ReviewProperties {
        if (defaultMinimumReviews < 0) defaultMinimumReviews = 0;
        if (writeAttempts <= 0) writeAttempts = 5;
        if (writeBackoff == null || writeBackoff.toMillis() < 1) writeBackoff = Duration.ofMillis(25);
        units = units == null ? Map.of() : Map.copyOf(units);
    }

    public record UnitPolicy(Integer minimumReviews) {
        public UnitPolicy {
            if (minimumReviews != null && minimumReviews < 0) minimumReviews = 0;
        }
    }

    public int minimumReviews(String unitId) {
        UnitPolicy policy = units.get(unitId);
        return policy != null && policy.minimumReviews() != null ? policy.minimumReviews() : defaultMinimumReviews;
    }
}
