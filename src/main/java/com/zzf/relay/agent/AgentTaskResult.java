package com.zzf.relay.agent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AgentTaskResult {

    /**
     * Returned when the run stopped because its abort signal was raised. Compared by identity.
     */
    public static final AgentTaskResult CANCELLED = new AgentTaskResult(null, null, true);

    private final String response;
    private final String sessionId;
    private final boolean cancelled;

    public static AgentTaskResult completed(String response, String sessionId) {
        return new AgentTaskResult(response == null ? "" : response, sessionId, false);
    }
}
