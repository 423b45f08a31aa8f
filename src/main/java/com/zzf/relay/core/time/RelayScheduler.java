package com.zzf.relay.core.time;

/**
 * Clock plus timer facility shared by the progress editor and session keepalive.
 */
public interface RelayScheduler {

    long currentTimeMillis();

    TimerHandle schedule(Runnable task, long delayMs);

    TimerHandle scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs);

    interface TimerHandle {
        /**
         * Cancels the timer. Safe to call more than once or after the timer fired.
         */
        void cancel();
    }
}
