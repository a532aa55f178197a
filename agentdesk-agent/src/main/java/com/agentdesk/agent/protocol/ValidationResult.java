package com.agentdesk.agent.protocol;

import java.util.List;

/**
 * Outcome of {@link MessageValidator#validate}.
 *
 * @param method   which check accepted the message
 * @param warnings strict-mode findings; empty for {@link Method#STRICT}
 */
public record ValidationResult(Method method, List<String> warnings) {

    public enum Method {
        STRICT,
        RELAXED,
        FAILED
    }

    public ValidationResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult strict() {
        return new ValidationResult(Method.STRICT, List.of());
    }

    public boolean isUsable() {
        return method != Method.FAILED;
    }
}
