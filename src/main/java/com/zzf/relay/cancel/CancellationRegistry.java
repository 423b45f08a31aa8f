package com.zzf.relay.cancel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of cancel token to abort callback. Lives as long as the application context.
 *
 * <p>A session registers its token when it starts and unregisters it in its own cleanup; the cancel
 * action may race with that cleanup, so {@link #trigger} and {@link #unregister} tolerate either order.
 */
@Slf4j
@Component
public class CancellationRegistry {

    private final Map<String, Runnable> callbacks = new ConcurrentHashMap<>();

    public void register(String token, Runnable callback) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(callback, "callback");
        Runnable previous = callbacks.put(token, callback);
        if (previous != null) {
            log.warn("cancel.register.replaced token={}", token);
        }
    }

    /**
     * Runs the callback registered for {@code token}, if any. The entry stays registered.
     *
     * @return whether a callback ran
     */
    public boolean trigger(String token) {
        if (token == null) {
            return false;
        }
        Runnable callback = callbacks.get(token);
        if (callback == null) {
            log.debug("cancel.trigger.unknown token={}", token);
            return false;
        }
        log.info("cancel.trigger token={}", token);
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("cancel.callback.failed token={} err={}", token, e.toString());
        }
        return true;
    }

    public void unregister(String token) {
        if (token == null) {
            return;
        }
        callbacks.remove(token);
    }

    public boolean isRegistered(String token) {
        return token != null && callbacks.containsKey(token);
    }

    public int size() {
        return callbacks.size();
    }
}
