package com.agentdesk.common.config;

/**
 * Read-only query defaults consumed when a prompt is sent.
 *
 * @param permissionMode backend permission mode
 * @param maxTurns       maximum agentic turns per query
 * @param model          model selector, may be null
 */
public record QuerySettings(String permissionMode, int maxTurns, String model) {

    public static QuerySettings defaults() {
        return new QuerySettings(ConfigDefaults.DEFAULT_PERMISSION_MODE, ConfigDefaults.DEFAULT_MAX_TURNS, null);
    }
}
