package com.zzf.relay.progress;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.relay.core.util.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns agent progress events into short status lines for the progress message.
 * Never throws; anything it cannot read yields no update.
 */
@Slf4j
@Component
public class ProgressClassifier {

    static final int THINKING_PREVIEW_CHARS = 150;
    static final int TEXT_PREVIEW_CHARS = 200;
    static final int SUMMARY_CHARS = 80;
    static final int GENERIC_FIELD_CHARS = 60;

    static final String PROCESSING_RESULTS = "⚙️ Processing results...";

    private static final Pattern MCP_PREFIX = Pattern.compile("^mcp__\\w+__");
    private static final Pattern LEADING_PARTIAL_LINE = Pattern.compile("^[^\\n]*\\n");

    public Optional<ProgressUpdate> classify(JsonNode record) {
        return classify(ProgressEventDecoder.decode(record));
    }

    public Optional<ProgressUpdate> classify(ProgressEvent event) {
        if (event == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(render(event)).map(text -> new ProgressUpdate(event.kind(), text));
        } catch (RuntimeException e) {
            log.debug("progress.classify.failed kind={} err={}", event.kind(), e.toString());
            return Optional.empty();
        }
    }

    private String render(ProgressEvent event) {
        switch (event.kind()) {
            case THINKING:
                return renderThinking((ProgressEvent.Thinking) event);
            case TOOL_USE:
                return renderToolUse((ProgressEvent.ToolUse) event);
            case TEXT_CHUNK:
                return renderText((ProgressEvent.TextChunk) event);
            case TOOL_RESULT:
                return PROCESSING_RESULTS;
            case UNRECOGNIZED:
            default:
                return null;
        }
    }

    private String renderThinking(ProgressEvent.Thinking thinking) {
        String thought = thinking.getText();
        if (thought.isEmpty()) {
            return null;
        }
        String preview = thought;
        if (thought.length() > THINKING_PREVIEW_CHARS) {
            String tail = thought.substring(thought.length() - THINKING_PREVIEW_CHARS);
            preview = StringUtils.ELLIPSIS + LEADING_PARTIAL_LINE.matcher(tail).replaceFirst("");
        }
        return "💭 " + preview;
    }

    private String renderToolUse(ProgressEvent.ToolUse toolUse) {
        String toolName = displayToolName(toolUse.getName());
        String summary = summarizeToolInput(toolUse.getInput());
        return summary.isEmpty()
                ? "🔧 " + toolName + " is running..."
                : "🔧 " + toolName + " " + summary;
    }

    private String renderText(ProgressEvent.TextChunk chunk) {
        String text = chunk.getText();
        if (text.trim().isEmpty()) {
            return null;
        }
        return "📝 Writing a response...\n\n" + StringUtils.ellipsize(text, TEXT_PREVIEW_CHARS);
    }

    static String displayToolName(String rawName) {
        String name = StringUtils.isBlank(rawName) ? "unknown" : rawName;
        return MCP_PREFIX.matcher(name).replaceFirst("").replace('_', ' ');
    }

    static String summarizeToolInput(JsonNode input) {
        if (input == null || !input.isObject()) {
            return "";
        }
        try {
            String value = field(input, "query");
            if (value != null) {
                return "🔍 \"" + StringUtils.ellipsize(value, SUMMARY_CHARS) + "\"";
            }
            value = field(input, "content");
            if (value != null) {
                return "🔍 \"" + StringUtils.ellipsize(value, SUMMARY_CHARS) + "\"";
            }
            value = field(input, "message");
            if (value != null) {
                return "💬 \"" + StringUtils.ellipsize(value, SUMMARY_CHARS) + "\"";
            }
            value = field(input, "page_id");
            if (value != null) {
                return "📄 page: " + StringUtils.truncate(value, 8) + StringUtils.ELLIPSIS;
            }
            value = field(input, "channelId");
            if (value != null) {
                return "📺 channel: " + StringUtils.ellipsize(value, SUMMARY_CHARS);
            }
            value = field(input, "threadId");
            if (value != null) {
                return "🧵 thread: " + StringUtils.ellipsize(value, SUMMARY_CHARS);
            }
            value = field(input, "path");
            if (value == null) {
                value = field(input, "file_path");
            }
            if (value != null) {
                return "📂 " + StringUtils.ellipsize(value, SUMMARY_CHARS);
            }
            value = field(input, "command");
            if (value != null) {
                return "$ " + StringUtils.ellipsize(value, SUMMARY_CHARS);
            }

            Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (entry.getValue() != null && entry.getValue().isTextual()) {
                    return entry.getKey() + ": " + StringUtils.ellipsize(entry.getValue().asText(), GENERIC_FIELD_CHARS);
                }
            }
            return "";
        } catch (RuntimeException e) {
            log.debug("progress.summary.failed err={}", e.toString());
            return "";
        }
    }

    private static String field(JsonNode input, String name) {
        JsonNode node = input.get(name);
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            return null;
        }
        return node.asText();
    }
}
