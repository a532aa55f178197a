package com.agentdesk.agent.normalize;

/**
 * The single transcript change a protocol message may cause.
 */
public sealed interface TranscriptDelta {

    /** Text to append to the query's assistant entry. */
    record AssistantText(String text) implements TranscriptDelta {
    }

    /** A standalone user-role line, e.g. a non-suppressed echo. */
    record UserLine(String text) implements TranscriptDelta {
    }

    /** Attach the turn's final accounting to the query's assistant entry. */
    record TurnFinalized(TurnResult result) implements TranscriptDelta {
    }
}
