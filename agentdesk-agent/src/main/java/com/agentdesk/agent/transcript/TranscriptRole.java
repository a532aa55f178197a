package com.agentdesk.agent.transcript;

public enum TranscriptRole {
    USER,
    ASSISTANT
}
