package com.reversiontrader.exception;

import java.util.List;
import java.util.Map;

/**
 * Raised at startup when strategy or risk parameters are invalid.
 * Carries every violation found, not just the first.
 */
public class ConfigurationException extends BaseException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super(
                ErrorCode.CONFIGURATION_INVALID,
                "Configuration validation failed:\n" + String.join("\n", violations),
                Map.of("violationCount", violations.size()));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
