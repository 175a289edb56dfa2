/*
 * TimerHandle.java
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

/**
 * Handle for a scheduled timer callback.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Endpoint#scheduleTimer(long, Runnable)
 */
public interface TimerHandle {

    /**
     * Cancels the timer. If the callback has not yet run it will not be
     * run. Cancelling an already cancelled timer has no effect.
     */
    void cancel();

    /**
     * Returns whether this timer has been cancelled.
     *
     * @return true if cancelled
     */
    boolean isCancelled();

}
