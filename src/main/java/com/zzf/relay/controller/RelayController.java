package com.zzf.relay.controller;

import com.zzf.relay.cancel.CancellationRegistry;
import com.zzf.relay.channel.SseReplyChannel;
import com.zzf.relay.core.util.StringUtils;
import com.zzf.relay.model.MentionRequest;
import com.zzf.relay.model.RelayRequestException;
import com.zzf.relay.session.MentionRelayService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP surface of the relay: mentions stream their progress back as SSE; the cancel button posts its token.
 */
@Slf4j
@RestController
@RequestMapping("/api/relay")
@RequiredArgsConstructor
public class RelayController {

    private static final long EMITTER_TIMEOUT_MS = 60 * 60 * 1000L;

    private final MentionRelayService relayService;
    private final CancellationRegistry cancellationRegistry;

    @Data
    public static class CancelRequest {
        private String token;
    }

    @PostMapping("/mention")
    public SseEmitter mention(@RequestBody MentionRequest request) {
        if (request == null) {
            throw new RelayRequestException("EMPTY_REQUEST", "request body is required");
        }
        if (StringUtils.isBlank(request.getChannelId())) {
            throw new RelayRequestException("MISSING_CHANNEL", "channelId is required");
        }
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        SseReplyChannel channel = new SseReplyChannel(emitter);
        emitter.onCompletion(() -> cancelAbandoned(channel, "completion"));
        emitter.onTimeout(() -> cancelAbandoned(channel, "timeout"));
        emitter.onError(e -> cancelAbandoned(channel, "error"));
        relayService.handleAsync(request, channel).whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("relay.mention.unhandled channel={}", request.getChannelId(), error);
                channel.finish("failed");
                return;
            }
            channel.finish(outcome == null || outcome.isEmpty()
                    ? "none"
                    : outcome.get().name().toLowerCase(Locale.ROOT));
        });
        return emitter;
    }

    /**
     * Stops the session behind a stream whose client went away. A finished session has already
     * unregistered its token, so this is a no-op after a normal completion.
     */
    boolean cancelAbandoned(SseReplyChannel channel, String reason) {
        String token = channel.getCancelToken();
        if (token == null) {
            return false;
        }
        boolean triggered = cancellationRegistry.trigger(token);
        if (triggered) {
            log.info("relay.mention.abandoned token={} reason={}", token, reason);
        }
        return triggered;
    }

    @PostMapping("/cancel")
    public Map<String, Object> cancel(@RequestBody CancelRequest request) {
        if (request == null || StringUtils.isBlank(request.getToken())) {
            throw new RelayRequestException("MISSING_TOKEN", "token is required");
        }
        String token = request.getToken().trim();
        boolean triggered = cancellationRegistry.trigger(token);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("token", token);
        response.put("status", triggered ? "cancel_requested" : "not_found");
        return response;
    }
}
