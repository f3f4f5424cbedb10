package com.phillippitts.slidefollow.testutil;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler that only records one-shot tasks; the test decides when they run.
 */
public class ManualTaskScheduler implements TaskScheduler {
    public final List<ScheduledTask> tasks = new CopyOnWriteArrayList<>();

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ScheduledTask scheduled = new ScheduledTask(task, startTime);
        tasks.add(scheduled);
        return scheduled;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException();
    }

    /** Runs every pending, non-cancelled task once. */
    public void runPending() {
        for (ScheduledTask task : tasks) {
            if (!task.isDone()) {
                task.run();
            }
        }
    }

    public ScheduledTask last() {
        return tasks.get(tasks.size() - 1);
    }

    public static final class ScheduledTask implements ScheduledFuture<Object> {
        private final Runnable task;
        public final Instant startTime;
        private volatile boolean cancelled;
        private volatile boolean done;

        ScheduledTask(Runnable task, Instant startTime) {
            this.task = task;
            this.startTime = startTime;
        }

        void run() {
            done = true;
            task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return 0;
        }

        @Override
        public int compareTo(Delayed other) {
            return 0;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            done = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
