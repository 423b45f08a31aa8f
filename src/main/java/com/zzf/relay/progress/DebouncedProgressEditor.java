package com.zzf.relay.progress;

import com.zzf.relay.core.time.RelayScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Throttles progress text into commits against one remote message.
 *
 * <p>Commits are at least {@code minIntervalMs} apart and the last text handed to {@link #commit}
 * always reaches the remote side unless the editor is closed first. Intermediate texts that arrive
 * inside one window are overwritten, never queued.
 *
 * <p>State moves {@code IDLE -> SCHEDULED -> COMMITTING -> IDLE}; {@code CLOSED} is terminal.
 * Transitions happen under the instance lock; the remote call itself runs outside it.
 */
@Slf4j
public class DebouncedProgressEditor {

    public enum State {
        IDLE,
        SCHEDULED,
        COMMITTING,
        CLOSED
    }

    private static final long NEVER = -1L;

    private final Consumer<String> committer;
    private final RelayScheduler scheduler;
    private final long minIntervalMs;

    private State state = State.IDLE;
    private long lastCommitAt = NEVER;
    private String pendingText;
    private RelayScheduler.TimerHandle pendingTimer;

    public DebouncedProgressEditor(Consumer<String> committer, RelayScheduler scheduler, long minIntervalMs) {
        this.committer = Objects.requireNonNull(committer, "committer");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.minIntervalMs = Math.max(0L, minIntervalMs);
    }

    public void commit(String text) {
        if (text == null) {
            return;
        }
        synchronized (this) {
            if (state == State.CLOSED) {
                return;
            }
            long now = scheduler.currentTimeMillis();
            long elapsed = lastCommitAt == NEVER ? Long.MAX_VALUE : now - lastCommitAt;
            if (state == State.IDLE && elapsed >= minIntervalMs) {
                beginCommit(now);
            } else {
                pendingText = text;
                if (state == State.IDLE) {
                    scheduleFlush(minIntervalMs - elapsed);
                }
                // SCHEDULED: the timer picks up the new text; COMMITTING: finishCommit schedules it
                return;
            }
        }
        execute(text);
    }

    public void close() {
        RelayScheduler.TimerHandle timer;
        synchronized (this) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            pendingText = null;
            timer = pendingTimer;
            pendingTimer = null;
        }
        if (timer != null) {
            timer.cancel();
        }
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean hasPendingText() {
        return pendingText != null;
    }

    private void flushPending() {
        String text;
        synchronized (this) {
            pendingTimer = null;
            if (state != State.SCHEDULED) {
                return;
            }
            text = pendingText;
            if (text == null) {
                state = State.IDLE;
                return;
            }
            beginCommit(scheduler.currentTimeMillis());
        }
        execute(text);
    }

    private void beginCommit(long now) {
        state = State.COMMITTING;
        lastCommitAt = now;
        pendingText = null;
    }

    private void execute(String text) {
        try {
            committer.accept(text);
        } catch (RuntimeException e) {
            log.debug("progress.edit.failed err={}", e.toString());
        }
        finishCommit();
    }

    private synchronized void finishCommit() {
        if (state != State.COMMITTING) {
            return;
        }
        if (pendingText == null) {
            state = State.IDLE;
            return;
        }
        long elapsed = scheduler.currentTimeMillis() - lastCommitAt;
        scheduleFlush(minIntervalMs - elapsed);
    }

    private void scheduleFlush(long delayMs) {
        state = State.SCHEDULED;
        pendingTimer = scheduler.schedule(this::flushPending, Math.max(0L, delayMs));
    }
}
