package com.zzf.relay.channel;

import com.zzf.relay.id.Identifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ReplyChannel} that forwards every chat operation as a server-sent event, for chat front ends
 * that talk to the relay over HTTP.
 */
@Slf4j
public class SseReplyChannel implements ReplyChannel {

    private final SseEmitter emitter;
    private volatile String cancelToken;

    public SseReplyChannel(SseEmitter emitter) {
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    @Override
    public String send(String text) {
        String id = Identifier.ascending("msg");
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", id);
        payload.put("text", text);
        sendSse("message", payload);
        return id;
    }

    @Override
    public String sendProgress(String text, String cancelToken) {
        String id = Identifier.ascending("progress");
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", id);
        payload.put("text", text);
        if (cancelToken != null) {
            this.cancelToken = cancelToken;
            payload.put("cancelToken", cancelToken);
        }
        sendSse("progress", payload);
        return id;
    }

    @Override
    public void edit(String handle, String text) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", handle);
        payload.put("text", text);
        sendSse("progress_edit", payload);
    }

    @Override
    public void delete(String handle) {
        sendSse("progress_delete", Map.of("id", handle));
    }

    @Override
    public void reply(String text) {
        sendSse("reply", Map.of("text", text == null ? "" : text));
    }

    @Override
    public void sendTyping() {
        sendSse("typing", Map.of("at", System.currentTimeMillis()));
    }

    /**
     * Cancel token of the session streaming into this channel, or null before its progress message was posted.
     */
    public String getCancelToken() {
        return cancelToken;
    }

    /**
     * Emits the terminal {@code done} event and completes the stream.
     */
    public void finish(String outcome) {
        try {
            sendSse("done", Map.of("outcome", outcome == null ? "none" : outcome));
        } catch (RelayChannelException e) {
            log.debug("sse.done.failed err={}", e.getMessage());
        }
        emitter.complete();
    }

    private void sendSse(String eventName, Object data) {
        try {
            synchronized (emitter) {
                emitter.send(SseEmitter.event().name(eventName).data(data));
            }
        } catch (IOException | IllegalStateException e) {
            throw new RelayChannelException("Failed to send SSE event " + eventName, e);
        }
    }
}
