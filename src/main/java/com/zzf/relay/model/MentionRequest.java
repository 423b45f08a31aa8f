package com.zzf.relay.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One inbound mention, with the bot mention already stripped from {@link #prompt}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionRequest {
    private String prompt;
    private String channelId;
    private String guildId;
    // set when the mention was posted inside a thread
    private String threadId;
    private String userId;
    private String username;
    private String messageId;
    @Builder.Default
    private List<String> imagePaths = new ArrayList<>();

    public boolean hasImages() {
        return imagePaths != null && !imagePaths.isEmpty();
    }
}
