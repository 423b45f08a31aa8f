package com.zzf.relay.channel;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long replies into chunks that fit the chat platform's message limit,
 * preferring line breaks, then spaces.
 */
public final class ReplySplitter {

    public static final int DEFAULT_LIMIT = 2000;

    private ReplySplitter() {
    }

    public static List<String> split(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        String remaining = text;
        while (!remaining.isEmpty()) {
            if (remaining.length() <= maxLength) {
                chunks.add(remaining);
                break;
            }
            int splitAt = remaining.lastIndexOf('\n', maxLength);
            if (splitAt == -1 || splitAt < maxLength * 0.5) {
                splitAt = remaining.lastIndexOf(' ', maxLength);
            }
            if (splitAt == -1 || splitAt < maxLength * 0.5) {
                splitAt = maxLength;
            }
            chunks.add(remaining.substring(0, splitAt));
            remaining = remaining.substring(splitAt).stripLeading();
        }
        return chunks;
    }
}
