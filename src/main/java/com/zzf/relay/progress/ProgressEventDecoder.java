package com.zzf.relay.progress;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps one raw agent stream record onto a {@link ProgressEvent}.
 * Thinking beats tool use, tool use beats text; anything unreadable is {@link ProgressEvent.Unrecognized}.
 */
@Slf4j
public final class ProgressEventDecoder {

    private ProgressEventDecoder() {
    }

    public static ProgressEvent decode(JsonNode record) {
        if (record == null || !record.isObject()) {
            return ProgressEvent.unrecognized();
        }
        try {
            return decodeRecord(record);
        } catch (RuntimeException e) {
            log.debug("progress.decode.failed err={}", e.toString());
            return ProgressEvent.unrecognized();
        }
    }

    private static ProgressEvent decodeRecord(JsonNode record) {
        String type = record.path("type").asText("");
        JsonNode content = record.path("message").path("content");

        if ("assistant".equals(type) && content.isArray()) {
            String thought = lastThinking(content);
            if (!thought.isEmpty()) {
                return ProgressEvent.thinking(thought);
            }
            JsonNode tool = lastBlockOfType(content, "tool_use");
            if (tool != null) {
                JsonNode name = tool.get("name");
                return ProgressEvent.toolUse(name != null && name.isTextual() ? name.asText() : null, tool.get("input"));
            }
            String text = joinedText(content);
            if (!text.isBlank()) {
                return ProgressEvent.textChunk(text);
            }
        }

        if ("tool_result".equals(type)) {
            return ProgressEvent.toolResult(false);
        }
        if ("result".equals(type)) {
            return ProgressEvent.toolResult(true);
        }
        // the CLI reports tool output as a user turn carrying tool_result blocks
        if ("user".equals(type) && content.isArray() && lastBlockOfType(content, "tool_result") != null) {
            return ProgressEvent.toolResult(false);
        }
        return ProgressEvent.unrecognized();
    }

    private static String lastThinking(JsonNode content) {
        String last = "";
        for (JsonNode block : content) {
            if (!"thinking".equals(block.path("type").asText(""))) {
                continue;
            }
            JsonNode thinking = block.get("thinking");
            if (thinking != null && thinking.isTextual() && !thinking.asText().isEmpty()) {
                last = thinking.asText();
            }
        }
        return last;
    }

    private static JsonNode lastBlockOfType(JsonNode content, String type) {
        JsonNode last = null;
        for (JsonNode block : content) {
            if (type.equals(block.path("type").asText(""))) {
                last = block;
            }
        }
        return last;
    }

    private static String joinedText(JsonNode content) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : content) {
            if (!"text".equals(block.path("type").asText(""))) {
                continue;
            }
            JsonNode text = block.get("text");
            if (text != null && text.isTextual()) {
                sb.append(text.asText());
            }
        }
        return sb.toString();
    }
}
