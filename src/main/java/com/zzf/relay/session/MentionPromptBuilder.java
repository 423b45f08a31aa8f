package com.zzf.relay.session;

import com.zzf.relay.model.MentionRequest;
import com.zzf.relay.core.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps the user's text with the chat metadata the agent needs to look things up on its own.
 */
public final class MentionPromptBuilder {

    static final String IMAGE_ONLY_REQUEST = "(Images are attached. Please review their contents.)";

    private MentionPromptBuilder() {
    }

    public static String build(MentionRequest request) {
        List<String> parts = new ArrayList<>();

        parts.add("<chat-context>");
        parts.add("Channel ID: " + nullToEmpty(request.getChannelId()));
        if (!StringUtils.isBlank(request.getGuildId())) {
            parts.add("Guild ID: " + request.getGuildId());
        }
        if (!StringUtils.isBlank(request.getThreadId())) {
            parts.add("Thread ID: " + request.getThreadId());
        }
        parts.add("User: " + nullToEmpty(request.getUsername()) + " (ID: " + nullToEmpty(request.getUserId()) + ")");
        parts.add("Message ID: " + nullToEmpty(request.getMessageId()));
        parts.add("</chat-context>");
        parts.add("");

        if (request.hasImages()) {
            List<String> paths = request.getImagePaths();
            parts.add("<attached-images>");
            parts.add("The user attached " + paths.size() + " image(s). They are saved at the paths below; open them with a file viewing tool:");
            for (String path : paths) {
                parts.add("- " + path);
            }
            parts.add("</attached-images>");
            parts.add("");
        }

        String prompt = request.getPrompt();
        parts.add(StringUtils.isBlank(prompt) ? IMAGE_ONLY_REQUEST : prompt.trim());
        return String.join("\n", parts);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
