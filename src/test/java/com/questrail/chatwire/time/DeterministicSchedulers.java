package com.questrail.chatwire.time;

import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.OwnedScheduler;
import com.questrail.chatwire.internal.time.SchedulerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SchedulerFactory handing out {@link DeterministicScheduler}s that share one
 * manual clock, so a test can advance time and run everything that is due.
 */
public final class DeterministicSchedulers implements SchedulerFactory {

    private final MonotonicClock clock;
    private final Map<String, DeterministicScheduler> opened = new LinkedHashMap<>();

    public DeterministicSchedulers(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized OwnedScheduler open(String name) {
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        opened.put(name + "#" + opened.size(), scheduler);
        return scheduler;
    }

    /**
     * Runs due tasks on every scheduler opened so far.
     */
    public void runDueTasks() {
        for (DeterministicScheduler s : snapshot()) {
            s.runDueTasks();
        }
    }

    public synchronized List<String> names() {
        return new ArrayList<>(opened.keySet());
    }

    public synchronized DeterministicScheduler named(String prefix) {
        return opened.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No scheduler opened with prefix " + prefix));
    }

    private synchronized List<DeterministicScheduler> snapshot() {
        return new ArrayList<>(opened.values());
    }
}
