package com.agentdesk.agent.error;

import java.util.List;

/**
 * A message failed the strict schema check but was still usable.
 * Reported as a notice; the turn continues.
 */
public class ValidationException extends QueryException {

    private final List<String> warnings;

    public ValidationException(String message, String agentId, String queryId, List<String> warnings) {
        super(message, agentId, queryId);
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
