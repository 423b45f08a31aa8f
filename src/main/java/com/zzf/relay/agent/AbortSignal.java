package com.zzf.relay.agent;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request handed to an agent task. The task polls {@link #isAborted()} at its own
 * suspension points or reacts through {@link #onAbort}; nothing is interrupted forcibly.
 */
@Slf4j
public class AbortSignal {

    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Raises the signal. Listeners run once, on the calling thread; later calls do nothing.
     */
    public void abort() {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            // removal claims the listener so a concurrent onAbort cannot run it twice
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
    }

    /**
     * Registers a listener. If the signal is already raised the listener runs immediately.
     */
    public void onAbort(Runnable listener) {
        listeners.add(listener);
        if (aborted.get() && listeners.remove(listener)) {
            runListener(listener);
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("abort.listener.failed err={}", e.toString());
        }
    }
}
