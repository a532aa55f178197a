package com.agentdesk.agent.normalize;

import java.util.List;
import java.util.Optional;

/**
 * Output of normalizing one protocol message: at most one transcript delta and
 * the ordered side-channel events.
 */
public record Normalization(Optional<TranscriptDelta> delta, List<QueryEvent> events) {

    private static final Normalization EMPTY = new Normalization(Optional.empty(), List.of());

    public Normalization {
        delta = delta != null ? delta : Optional.empty();
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static Normalization empty() {
        return EMPTY;
    }

    public static Normalization of(TranscriptDelta delta, List<QueryEvent> events) {
        return new Normalization(Optional.ofNullable(delta), events);
    }

    public static Normalization events(List<QueryEvent> events) {
        return new Normalization(Optional.empty(), events);
    }

    public boolean isEmpty() {
        return delta.isEmpty() && events.isEmpty();
    }
}
