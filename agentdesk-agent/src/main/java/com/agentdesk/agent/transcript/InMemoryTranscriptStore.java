package com.agentdesk.agent.transcript;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TranscriptStore} backed by per-agent lists. Stores and returns copies,
 * so callers may keep mutating their own entries.
 */
@Slf4j
public class InMemoryTranscriptStore implements TranscriptStore {

    private final Map<String, List<TranscriptMessage>> transcripts = new ConcurrentHashMap<>();

    @Override
    public void appendOrUpdateMessage(String agentId, TranscriptMessage message) {
        List<TranscriptMessage> list = transcripts.computeIfAbsent(agentId, k -> new ArrayList<>());
        synchronized (list) {
            for (int i = list.size() - 1; i >= 0; i--) {
                if (list.get(i).getId().equals(message.getId())) {
                    list.set(i, message.copy());
                    return;
                }
            }
            list.add(message.copy());
            log.debug("transcript append: agentId={} role={} size={}", agentId, message.getRole(), list.size());
        }
    }

    @Override
    public List<TranscriptMessage> getMessages(String agentId) {
        List<TranscriptMessage> list = transcripts.get(agentId);
        if (list == null) {
            return Collections.emptyList();
        }
        synchronized (list) {
            List<TranscriptMessage> copy = new ArrayList<>(list.size());
            for (TranscriptMessage m : list) {
                copy.add(m.copy());
            }
            return copy;
        }
    }

    @Override
    public void clear(String agentId) {
        transcripts.remove(agentId);
    }
}
