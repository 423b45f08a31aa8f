package com.zzf.relay.progress;

import com.zzf.relay.core.time.ManualRelayScheduler;
import com.zzf.relay.core.time.RelayScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DebouncedProgressEditorTest {

    private static final long WINDOW = 2000L;

    private ManualRelayScheduler scheduler;
    private List<String> commits;
    private List<Long> commitTimes;
    private DebouncedProgressEditor editor;

    @BeforeEach
    void setUp() {
        scheduler = new ManualRelayScheduler();
        commits = new ArrayList<>();
        commitTimes = new ArrayList<>();
        editor = new DebouncedProgressEditor(text -> {
            commits.add(text);
            commitTimes.add(scheduler.currentTimeMillis());
        }, scheduler, WINDOW);
    }

    @Test
    void shouldCommitFirstTextImmediatelyAndCoalesceTheRestOfTheWindow() {
        editor.commit("A");
        scheduler.advanceTo(500);
        editor.commit("B");
        scheduler.advanceTo(900);
        editor.commit("C");

        assertEquals(List.of("A"), commits);
        assertEquals(DebouncedProgressEditor.State.SCHEDULED, editor.state());

        scheduler.advanceTo(1999);
        assertEquals(List.of("A"), commits);

        scheduler.advanceTo(2000);
        assertEquals(List.of("A", "C"), commits);
        assertEquals(List.of(0L, 2000L), commitTimes);
        assertEquals(DebouncedProgressEditor.State.IDLE, editor.state());
    }

    @Test
    void shouldCommitExactlyOnceForBurstInsideOneWindowCarryingLastText() {
        editor.commit("first");
        for (int i = 1; i <= 20; i++) {
            scheduler.advanceTo(i * 50L);
            editor.commit("burst-" + i);
        }
        scheduler.advanceTo(10_000);

        assertEquals(List.of("first", "burst-20"), commits);
    }

    @Test
    void shouldCommitImmediatelyWhenWindowHasElapsed() {
        editor.commit("one");
        scheduler.advanceTo(2500);
        editor.commit("two");

        assertEquals(List.of("one", "two"), commits);
        assertEquals(List.of(0L, 2500L), commitTimes);
        assertEquals(0, scheduler.pendingTimers());
    }

    @Test
    void shouldKeepCommitsAtLeastOneWindowApart() {
        for (long t = 0; t <= 9000; t += 300) {
            scheduler.advanceTo(t);
            editor.commit("t=" + t);
        }
        scheduler.advanceTo(20_000);

        for (int i = 1; i < commitTimes.size(); i++) {
            assertTrue(commitTimes.get(i) - commitTimes.get(i - 1) >= WINDOW,
                    "commits too close: " + commitTimes);
        }
        assertEquals("t=9000", commits.get(commits.size() - 1));
    }

    @Test
    void shouldNotCommitAfterClose() {
        editor.commit("A");
        scheduler.advanceTo(100);
        editor.commit("B");
        editor.close();
        scheduler.advanceTo(5000);
        editor.commit("C");

        assertEquals(List.of("A"), commits);
        assertEquals(DebouncedProgressEditor.State.CLOSED, editor.state());
        assertFalse(editor.hasPendingText());
        assertEquals(0, scheduler.pendingTimers());
    }

    @Test
    void closeShouldBeIdempotent() {
        editor.close();
        editor.close();
        assertEquals(DebouncedProgressEditor.State.CLOSED, editor.state());
    }

    @Test
    void shouldSwallowCommitFailuresAndKeepWorking() {
        List<String> attempted = new ArrayList<>();
        DebouncedProgressEditor failing = new DebouncedProgressEditor(text -> {
            attempted.add(text);
            throw new IllegalStateException("message deleted");
        }, scheduler, WINDOW);

        failing.commit("A");
        scheduler.advanceTo(10);
        failing.commit("B");
        scheduler.advanceTo(4000);
        failing.commit("C");

        assertEquals(List.of("A", "B", "C"), attempted);
        assertEquals(DebouncedProgressEditor.State.IDLE, failing.state());
    }

    @Test
    void shouldScheduleTextArrivingWhileCommitIsInFlight() {
        List<String> seen = new ArrayList<>();
        DebouncedProgressEditor[] holder = new DebouncedProgressEditor[1];
        holder[0] = new DebouncedProgressEditor(text -> {
            seen.add(text);
            if ("A".equals(text)) {
                // a new update lands while the remote edit for A is still running
                holder[0].commit("B");
                assertEquals(DebouncedProgressEditor.State.COMMITTING, holder[0].state());
            }
        }, scheduler, WINDOW);

        holder[0].commit("A");
        assertEquals(List.of("A"), seen);
        assertEquals(DebouncedProgressEditor.State.SCHEDULED, holder[0].state());

        scheduler.advanceTo(2000);
        assertEquals(List.of("A", "B"), seen);
    }

    @Test
    void shouldDoNothingWhenTimerFiresAfterClose() {
        List<Runnable> captured = new ArrayList<>();
        RelayScheduler racingScheduler = new RelayScheduler() {
            @Override
            public long currentTimeMillis() {
                return 100L;
            }

            @Override
            public TimerHandle schedule(Runnable task, long delayMs) {
                captured.add(task);
                // cancel loses the race: the task still runs below
                return () -> { };
            }

            @Override
            public TimerHandle scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
                throw new UnsupportedOperationException();
            }
        };
        List<String> racingCommits = new ArrayList<>();
        DebouncedProgressEditor racing = new DebouncedProgressEditor(racingCommits::add, racingScheduler, WINDOW);

        racing.commit("A");
        racing.commit("B");
        assertEquals(1, captured.size());

        racing.close();
        captured.get(0).run();

        assertEquals(List.of("A"), racingCommits);
        assertEquals(DebouncedProgressEditor.State.CLOSED, racing.state());
        assertFalse(racing.hasPendingText());
    }
}
