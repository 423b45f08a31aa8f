package com.zzf.relay.core.time;

import com.zzf.relay.config.RelayConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timer pool for debounce flushes and typing keepalives, sized by {@code relay.timer.pool-size}.
 * The pool must not be registered as an {@code Executor} bean: that would replace the
 * {@code spring.task.execution} executor behind {@code @Async}.
 */
@Slf4j
@Component
public class ExecutorRelayScheduler implements RelayScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorRelayScheduler(RelayConfig config) {
        int poolSize = Math.max(1, config.getTimer().getPoolSize());
        AtomicInteger threadIndex = new AtomicInteger();
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(poolSize, r -> {
            Thread t = new Thread(r, "relay-timer-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        pool.setRemoveOnCancelPolicy(true);
        this.executor = pool;
        log.info("relay.timer.started poolSize={}", poolSize);
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public TimerHandle schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> future = executor.schedule(guard(task), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                guard(task), Math.max(0L, initialDelayMs), periodMs, TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    // a throwing periodic task would otherwise be silently descheduled
    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("relay.timer.task_failed err={}", e.toString());
            }
        };
    }

    @RequiredArgsConstructor
    private static final class FutureHandle implements TimerHandle {
        private final ScheduledFuture<?> future;

        @Override
        public void cancel() {
            future.cancel(false);
        }
    }
}
