package com.zzf.relay.agent;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AgentTaskRequest {
    String prompt;
    String workDir;
    // continuation token from a previous run in the same channel, may be null
    String resumeSessionId;
}
