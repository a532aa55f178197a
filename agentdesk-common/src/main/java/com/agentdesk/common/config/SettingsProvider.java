package com.agentdesk.common.config;

/**
 * Source of query defaults. Implementations must be cheap to call; they are
 * consulted on every send.
 */
@FunctionalInterface
public interface SettingsProvider {

    QuerySettings current();

    static SettingsProvider of(QuerySettings settings) {
        return () -> settings;
    }

    static SettingsProvider fromConfig(ConfigService configService) {
        return () -> {
            DeskConfig.QueryConfig query = configService.loadConfig().getQuery();
            return new QuerySettings(query.getPermissionMode(), query.getMaxTurns(), query.getModel());
        };
    }
}
