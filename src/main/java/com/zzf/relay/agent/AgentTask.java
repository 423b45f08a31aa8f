package com.zzf.relay.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Consumer;

/**
 * Long-running external agent invocation.
 */
public interface AgentTask {

    /**
     * Runs the agent to completion, forwarding every stream record to {@code onEvent} in arrival order.
     *
     * @return the final result, or {@link AgentTaskResult#CANCELLED} when {@code abort} stopped the run
     * @throws AgentTaskException when the agent fails
     */
    AgentTaskResult run(AgentTaskRequest request, AbortSignal abort, Consumer<JsonNode> onEvent);
}
