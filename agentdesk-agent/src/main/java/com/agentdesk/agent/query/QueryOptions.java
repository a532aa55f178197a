package com.agentdesk.agent.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-send overrides. Null fields fall back to the session, then to the
 * settings defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryOptions {

    private List<String> attachmentRefs;
    private String permissionMode;
    private Integer maxTurns;
    private String model;
    private String cwd;

    public static QueryOptions defaults() {
        return new QueryOptions();
    }
}
