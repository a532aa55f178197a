package com.agentdesk.common.config;

/**
 * Default values for settings that the config file leaves out.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    public static final String DEFAULT_PERMISSION_MODE = "default";
    public static final int DEFAULT_MAX_TURNS = 10;
    public static final long DEFAULT_INTERRUPTION_WINDOW_MS = 15_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000L;

    /**
     * Fill in missing sections and fields.
     */
    public static DeskConfig applyDefaults(DeskConfig config) {
        if (config.getQuery() == null) {
            config.setQuery(new DeskConfig.QueryConfig());
        }
        DeskConfig.QueryConfig query = config.getQuery();
        if (query.getPermissionMode() == null || query.getPermissionMode().isBlank()) {
            query.setPermissionMode(DEFAULT_PERMISSION_MODE);
        }
        if (query.getMaxTurns() == null || query.getMaxTurns() <= 0) {
            query.setMaxTurns(DEFAULT_MAX_TURNS);
        }
        if (query.getInterruptionWindowMs() == null || query.getInterruptionWindowMs() <= 0) {
            query.setInterruptionWindowMs(DEFAULT_INTERRUPTION_WINDOW_MS);
        }
        if (query.getSweepIntervalMs() == null || query.getSweepIntervalMs() <= 0) {
            query.setSweepIntervalMs(DEFAULT_SWEEP_INTERVAL_MS);
        }
        return config;
    }
}
