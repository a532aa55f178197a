package com.agentdesk.agent.orchestrator;

import com.agentdesk.common.config.ConfigDefaults;
import com.agentdesk.common.config.DeskConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Time source and timing constants of a {@link StreamingQueryOrchestrator}.
 *
 * @param clock              source of "now" for query start times and interruption windows
 * @param interruptionWindow how long a user cancel suppresses late echoes and errors
 * @param sweepInterval      period of the expired-interruption sweep
 * @param startSweeper       whether to run the sweep on a background thread
 */
public record OrchestratorOptions(Clock clock, Duration interruptionWindow, Duration sweepInterval,
                                  boolean startSweeper) {

    public static final Duration DEFAULT_INTERRUPTION_WINDOW =
            Duration.ofMillis(ConfigDefaults.DEFAULT_INTERRUPTION_WINDOW_MS);
    public static final Duration DEFAULT_SWEEP_INTERVAL =
            Duration.ofMillis(ConfigDefaults.DEFAULT_SWEEP_INTERVAL_MS);

    public OrchestratorOptions {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(interruptionWindow, "interruptionWindow");
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
    }

    public static OrchestratorOptions defaults() {
        return new OrchestratorOptions(Clock.systemUTC(), DEFAULT_INTERRUPTION_WINDOW, DEFAULT_SWEEP_INTERVAL, true);
    }

    /**
     * Manual-sweep options for a controllable clock.
     */
    public static OrchestratorOptions withClock(Clock clock) {
        return new OrchestratorOptions(clock, DEFAULT_INTERRUPTION_WINDOW, DEFAULT_SWEEP_INTERVAL, false);
    }

    public static OrchestratorOptions fromConfig(DeskConfig config) {
        DeskConfig.QueryConfig query = ConfigDefaults.applyDefaults(config).getQuery();
        return new OrchestratorOptions(Clock.systemUTC(),
                Duration.ofMillis(query.getInterruptionWindowMs()),
                Duration.ofMillis(query.getSweepIntervalMs()),
                true);
    }
}
