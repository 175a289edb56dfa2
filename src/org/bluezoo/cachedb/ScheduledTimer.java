/*
 * ScheduledTimer.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of cachedb, a minimal RESP key-value cache server.
 *
 * cachedb is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * cachedb is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with cachedb.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.cachedb;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Timer service for scheduling callbacks on SelectorLoop threads.
 *
 * <p>The server uses this for connection idle timeouts. The timer runs
 * in its own thread but never runs callbacks itself: when an entry
 * fires it is handed to the SelectorLoop it was scheduled for, which
 * runs the callback on its own thread. A callback may therefore touch
 * connection and store state without further synchronization.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ScheduledTimer extends Thread {

    private static final Logger LOGGER = Logger.getLogger(ScheduledTimer.class.getName());

    private static final AtomicLong TIMER_ID_GENERATOR = new AtomicLong(0);

    private final PriorityQueue<TimerEntry> queue;
    private final Lock lock;
    private final Condition condition;
    private volatile boolean active;

    ScheduledTimer() {
        super("ScheduledTimer");
        setDaemon(true);
        this.queue = new PriorityQueue<>();
        this.lock = new ReentrantLock();
        this.condition = lock.newCondition();
        this.active = true;
    }

    @Override
    public void run() {
        while (active) {
            lock.lock();
            try {
                while (active && queue.isEmpty()) {
                    condition.await();
                }
                if (!active) {
                    break;
                }
                TimerEntry next = queue.peek();
                long delay = next.fireTime - System.currentTimeMillis();
                if (delay <= 0) {
                    queue.poll();
                    if (!next.cancelled) {
                        next.loop.dispatchTimer(next);
                    }
                } else {
                    condition.awaitNanos(delay * 1_000_000);
                }
            } catch (InterruptedException e) {
                if (!active) {
                    break;
                }
            } finally {
                lock.unlock();
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("ScheduledTimer shutdown");
        }
    }

    /**
     * Schedules a timer callback.
     *
     * @param loop the selector loop that will run the callback
     * @param delayMs delay in milliseconds
     * @param callback the callback to execute
     * @return a TimerHandle that can be used to cancel the timer
     */
    TimerHandle schedule(SelectorLoop loop, long delayMs, Runnable callback) {
        long fireTime = System.currentTimeMillis() + delayMs;
        TimerEntry entry = new TimerEntry(TIMER_ID_GENERATOR.incrementAndGet(),
                fireTime, loop, callback);
        lock.lock();
        try {
            queue.offer(entry);
            condition.signal();
        } finally {
            lock.unlock();
        }
        return entry;
    }

    /**
     * Shuts down the timer thread. Pending entries are discarded.
     */
    void shutdown() {
        active = false;
        lock.lock();
        try {
            queue.clear();
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Timer entry in the priority queue.
     * Cancelled entries stay queued and are skipped when they fire.
     */
    static final class TimerEntry implements TimerHandle, Comparable<TimerEntry> {
        final long id;
        final long fireTime;
        final SelectorLoop loop;
        final Runnable callback;
        volatile boolean cancelled;

        TimerEntry(long id, long fireTime, SelectorLoop loop, Runnable callback) {
            this.id = id;
            this.fireTime = fireTime;
            this.loop = loop;
            this.callback = callback;
        }

        @Override
        public int compareTo(TimerEntry other) {
            int cmp = Long.compare(this.fireTime, other.fireTime);
            if (cmp == 0) {
                cmp = Long.compare(this.id, other.id);
            }
            return cmp;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }

}
