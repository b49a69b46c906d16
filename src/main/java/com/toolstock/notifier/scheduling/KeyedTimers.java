package com.toolstock.notifier.scheduling;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * At most one pending delayed task per key.
 *
 * <p>Scheduling for a key that already has a pending task cancels the old one
 * first, which gives debounce semantics. A task is removed from the table
 * before it runs, so a task that fires can never be cancelled half-way and a
 * newer task for the same key is never confused with it.
 *
 * @param <K> key type, e.g. a conversation id
 */
public final class KeyedTimers<K> {

    private final TaskScheduler scheduler;
    private final Map<K, Timer> pending = new HashMap<>();

    public KeyedTimers(final TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Schedule {@code task} for {@code key} after {@code delay}.
     *
     * @return {@code true} if a previously pending task for the key was cancelled
     */
    public synchronized boolean schedule(final K key, final Duration delay, final Runnable task) {
        final boolean replaced = cancel(key);
        final Timer timer = new Timer(task);
        pending.put(key, timer);
        timer.handle = scheduler.schedule(() -> fire(key, timer), delay);
        return replaced;
    }

    /** @return {@code true} if a pending task existed and was cancelled */
    public synchronized boolean cancel(final K key) {
        final Timer timer = pending.remove(key);
        if (timer == null) {
            return false;
        }
        if (timer.handle != null) {
            timer.handle.cancel();
        }
        return true;
    }

    /** @return number of tasks that were pending */
    public synchronized int cancelAll() {
        final int count = pending.size();
        for (final Timer timer : pending.values()) {
            if (timer.handle != null) {
                timer.handle.cancel();
            }
        }
        pending.clear();
        return count;
    }

    public synchronized boolean isPending(final K key) {
        return pending.containsKey(key);
    }

    public synchronized int size() {
        return pending.size();
    }

    private void fire(final K key, final Timer timer) {
        synchronized (this) {
            // Lost the race against cancel() or a newer schedule() for the same key
            if (!pending.remove(key, timer)) {
                return;
            }
        }
        timer.task.run();
    }

    private static final class Timer {
        private final Runnable task;
        private ScheduledHandle handle;

        private Timer(final Runnable task) {
            this.task = task;
        }
    }
}
