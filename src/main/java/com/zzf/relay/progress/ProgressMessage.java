package com.zzf.relay.progress;

import com.zzf.relay.channel.ReplyChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * The single remote message that shows a session's progress. Posted on first use, edited afterwards.
 * All remote failures are absorbed: the message may have been deleted by someone else.
 */
@Slf4j
public class ProgressMessage {

    private final ReplyChannel channel;
    private final String cancelToken;
    private volatile String handle;
    private volatile boolean removed;

    public ProgressMessage(ReplyChannel channel, String cancelToken) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.cancelToken = cancelToken;
    }

    public synchronized void show(String text) {
        if (removed) {
            return;
        }
        if (handle == null) {
            handle = channel.sendProgress(text, cancelToken);
            return;
        }
        channel.edit(handle, text);
    }

    /**
     * Like {@link #show} but never throws.
     */
    public void showQuietly(String text) {
        try {
            show(text);
        } catch (RuntimeException e) {
            log.debug("progress.show.failed handle={} err={}", handle, e.toString());
        }
    }

    public synchronized void remove() {
        if (removed) {
            return;
        }
        removed = true;
        String current = handle;
        handle = null;
        if (current == null) {
            return;
        }
        try {
            channel.delete(current);
        } catch (RuntimeException e) {
            log.debug("progress.delete.failed handle={} err={}", current, e.toString());
        }
    }

    public String getHandle() {
        return handle;
    }

    public boolean isPosted() {
        return handle != null;
    }
}
