package com.zzf.relay.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.relay.agent.AbortSignal;
import com.zzf.relay.cancel.CancellationRegistry;
import com.zzf.relay.channel.ReplyChannel;
import com.zzf.relay.core.time.RelayScheduler;
import com.zzf.relay.progress.DebouncedProgressEditor;
import com.zzf.relay.progress.ProgressClassifier;
import com.zzf.relay.progress.ProgressMessage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-mention state: progress message, its debounced editor, cancel registration and keepalive.
 * Created by {@link MentionRelayService} for one request and cleaned up exactly once when it ends.
 */
@Slf4j
public class ProgressSession {

    @Getter
    private final String cancelToken;
    private final ReplyChannel channel;
    private final CancellationRegistry registry;
    private final RelayScheduler scheduler;
    private final ProgressClassifier classifier;
    @Getter
    private final ProgressMessage progressMessage;
    @Getter
    private final DebouncedProgressEditor editor;
    @Getter
    private final AbortSignal abortSignal = new AbortSignal();

    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);
    private volatile SessionState state = SessionState.INIT;
    private volatile SessionState outcome;
    private volatile RelayScheduler.TimerHandle keepalive;

    public ProgressSession(String cancelToken,
                           ReplyChannel channel,
                           CancellationRegistry registry,
                           RelayScheduler scheduler,
                           ProgressClassifier classifier,
                           long editDebounceMs) {
        this.cancelToken = cancelToken;
        this.channel = channel;
        this.registry = registry;
        this.scheduler = scheduler;
        this.classifier = classifier;
        this.progressMessage = new ProgressMessage(channel, cancelToken);
        this.editor = new DebouncedProgressEditor(progressMessage::show, scheduler, editDebounceMs);
    }

    /**
     * INIT: registers the cancel token, starts the typing keepalive and posts the placeholder
     * when {@code placeholderText} is not null.
     */
    public void open(long keepaliveIntervalMs, String placeholderText) {
        registry.register(cancelToken, this::requestCancel);
        keepalive = scheduler.scheduleAtFixedRate(this::sendTypingQuietly, 0L, keepaliveIntervalMs);
        if (placeholderText != null && !abortSignal.isAborted()) {
            progressMessage.showQuietly(placeholderText);
        }
        state = SessionState.RUNNING;
    }

    /**
     * Feeds one agent stream record. Ignored once a cancel was requested or the session left RUNNING.
     */
    public void onEvent(JsonNode record) {
        if (abortSignal.isAborted() || state != SessionState.RUNNING) {
            return;
        }
        classifier.classify(record).ifPresent(update -> editor.commit(update.getDisplayText()));
    }

    /**
     * Registered as the cancel callback. Stops progress commits right away and asks the task to stop.
     */
    public void requestCancel() {
        log.info("relay.session.cancel_requested token={}", cancelToken);
        editor.close();
        abortSignal.abort();
    }

    public boolean isCancelRequested() {
        return abortSignal.isAborted();
    }

    void finish(SessionState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal state: " + terminal);
        }
        state = terminal;
        outcome = terminal;
        editor.close();
        progressMessage.remove();
    }

    /**
     * CLEANED_UP: stops the keepalive, closes the editor and unregisters the token. Runs once;
     * a failing step does not stop the ones after it.
     */
    public void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        step("keepalive", () -> {
            RelayScheduler.TimerHandle handle = keepalive;
            if (handle != null) {
                handle.cancel();
            }
        });
        step("editor", editor::close);
        step("cancel_token", () -> registry.unregister(cancelToken));
        state = SessionState.CLEANED_UP;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Terminal state reached before cleanup, or null while the session is still running.
     */
    public SessionState getOutcome() {
        return outcome;
    }

    public boolean isCleanedUp() {
        return cleanedUp.get();
    }

    private void sendTypingQuietly() {
        try {
            channel.sendTyping();
        } catch (RuntimeException e) {
            log.debug("relay.typing.failed err={}", e.toString());
        }
    }

    private void step(String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("relay.session.cleanup_step_failed step={} token={} err={}", name, cancelToken, e.toString());
        }
    }
}
