package com.zzf.relay.progress;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Agent stream record reduced to the single signal that matters for progress display.
 * One subclass per recognized kind plus {@link Unrecognized}.
 */
public abstract class ProgressEvent {

    public enum Kind {
        THINKING,
        TOOL_USE,
        TEXT_CHUNK,
        TOOL_RESULT,
        UNRECOGNIZED
    }

    private ProgressEvent() {
    }

    public abstract Kind kind();

    public static Thinking thinking(String text) {
        return new Thinking(text);
    }

    public static ToolUse toolUse(String name, JsonNode input) {
        return new ToolUse(name, input);
    }

    public static TextChunk textChunk(String text) {
        return new TextChunk(text);
    }

    public static ToolResult toolResult(boolean finalResult) {
        return new ToolResult(finalResult);
    }

    public static Unrecognized unrecognized() {
        return Unrecognized.INSTANCE;
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Thinking extends ProgressEvent {
        private final String text;

        private Thinking(String text) {
            this.text = text == null ? "" : text;
        }

        @Override
        public Kind kind() {
            return Kind.THINKING;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class ToolUse extends ProgressEvent {
        private final String name;
        private final JsonNode input;

        private ToolUse(String name, JsonNode input) {
            this.name = name;
            this.input = input == null ? MissingNode.getInstance() : input;
        }

        @Override
        public Kind kind() {
            return Kind.TOOL_USE;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class TextChunk extends ProgressEvent {
        private final String text;

        private TextChunk(String text) {
            this.text = text == null ? "" : text;
        }

        @Override
        public Kind kind() {
            return Kind.TEXT_CHUNK;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class ToolResult extends ProgressEvent {
        // true for the terminal "result" record of the run
        private final boolean finalResult;

        private ToolResult(boolean finalResult) {
            this.finalResult = finalResult;
        }

        @Override
        public Kind kind() {
            return Kind.TOOL_RESULT;
        }
    }

    @ToString
    public static final class Unrecognized extends ProgressEvent {
        private static final Unrecognized INSTANCE = new Unrecognized();

        private Unrecognized() {
        }

        @Override
        public Kind kind() {
            return Kind.UNRECOGNIZED;
        }
    }
}
