package com.zzf.relay.agent;

public class AgentTaskException extends RuntimeException {
    public AgentTaskException(String message) {
        super(message);
    }

    public AgentTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
