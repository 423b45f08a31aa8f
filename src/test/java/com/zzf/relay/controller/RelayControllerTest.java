package com.zzf.relay.controller;

import com.zzf.relay.cancel.CancellationRegistry;
import com.zzf.relay.channel.ReplyChannel;
import com.zzf.relay.channel.SseReplyChannel;
import com.zzf.relay.model.MentionRequest;
import com.zzf.relay.model.RelayRequestException;
import com.zzf.relay.session.MentionRelayService;
import com.zzf.relay.session.SessionState;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RelayControllerTest {

    private final MentionRelayService relayService = mock(MentionRelayService.class);
    private final CancellationRegistry registry = new CancellationRegistry();
    private final RelayController controller = new RelayController(relayService, registry);

    @Test
    void shouldRequestCancelForRegisteredToken() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("cancel_abc", calls::incrementAndGet);

        RelayController.CancelRequest request = new RelayController.CancelRequest();
        request.setToken(" cancel_abc ");
        Map<String, Object> response = controller.cancel(request);

        assertEquals("cancel_abc", response.get("token"));
        assertEquals("cancel_requested", response.get("status"));
        assertEquals(1, calls.get());
    }

    @Test
    void shouldReportUnknownToken() {
        RelayController.CancelRequest request = new RelayController.CancelRequest();
        request.setToken("cancel_gone");

        assertEquals("not_found", controller.cancel(request).get("status"));
    }

    @Test
    void shouldRejectBlankToken() {
        RelayController.CancelRequest request = new RelayController.CancelRequest();
        request.setToken("  ");

        RelayRequestException error = assertThrows(RelayRequestException.class, () -> controller.cancel(request));
        assertEquals("MISSING_TOKEN", error.getErrorCode());
    }

    @Test
    void shouldRejectMentionWithoutChannel() {
        MentionRequest request = MentionRequest.builder().prompt("hello").build();

        RelayRequestException error = assertThrows(RelayRequestException.class, () -> controller.mention(request));
        assertEquals("MISSING_CHANNEL", error.getErrorCode());
        verify(relayService, never()).handleAsync(any(), any());
    }

    @Test
    void shouldHandMentionToServiceAndStream() {
        MentionRequest request = MentionRequest.builder().prompt("hello").channelId("c-1").build();
        when(relayService.handleAsync(same(request), any(ReplyChannel.class)))
                .thenReturn(CompletableFuture.completedFuture(Optional.of(SessionState.COMPLETED)));

        SseEmitter emitter = controller.mention(request);

        assertNotNull(emitter);
        verify(relayService).handleAsync(same(request), any(ReplyChannel.class));
    }

    @Test
    void shouldCancelSessionWhenStreamIsAbandoned() {
        AtomicInteger calls = new AtomicInteger();
        registry.register("cancel_live", calls::incrementAndGet);
        SseReplyChannel channel = new SseReplyChannel(new SseEmitter());
        channel.sendProgress("🤔 Thinking...", "cancel_live");

        assertTrue(controller.cancelAbandoned(channel, "timeout"));
        assertEquals(1, calls.get());
    }

    @Test
    void shouldIgnoreAbandonedStreamWithoutSessionOrAfterCleanup() {
        SseReplyChannel fresh = new SseReplyChannel(new SseEmitter());
        assertFalse(controller.cancelAbandoned(fresh, "error"));

        AtomicInteger calls = new AtomicInteger();
        registry.register("cancel_done", calls::incrementAndGet);
        SseReplyChannel finished = new SseReplyChannel(new SseEmitter());
        finished.sendProgress("🤔 Thinking...", "cancel_done");
        registry.unregister("cancel_done");

        assertFalse(controller.cancelAbandoned(finished, "completion"));
        assertEquals(0, calls.get());
    }
}
