package com.agentdesk.common.config;

import lombok.Data;

/**
 * Root configuration type for agentdesk.
 * Bound from the desktop client's settings JSON; unknown sections are ignored.
 */
@Data
public class DeskConfig {

    /** Query defaults applied at send time. */
    private QueryConfig query;

    // --- Nested config types ---

    @Data
    public static class QueryConfig {
        /** Backend permission mode ("default", "acceptEdits", "plan", "bypassPermissions"). */
        private String permissionMode = ConfigDefaults.DEFAULT_PERMISSION_MODE;
        private Integer maxTurns = ConfigDefaults.DEFAULT_MAX_TURNS;
        /** Optional model selector; null lets the backend choose. */
        private String model;
        private Long interruptionWindowMs = ConfigDefaults.DEFAULT_INTERRUPTION_WINDOW_MS;
        private Long sweepIntervalMs = ConfigDefaults.DEFAULT_SWEEP_INTERVAL_MS;
    }
}
