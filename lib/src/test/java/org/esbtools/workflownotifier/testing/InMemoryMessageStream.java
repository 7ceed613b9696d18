/*
 *  Copyright 2026 esbtools Contributors and/or its affiliates.
 *
 *  This file is part of esbtools.
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.esbtools.workflownotifier.testing;

import org.esbtools.workflownotifier.LogMessage;
import org.esbtools.workflownotifier.MessageStream;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

public class InMemoryMessageStream implements MessageStream {
    private final BlockingQueue<LogMessage> messages = new LinkedBlockingQueue<>();
    private volatile boolean started = false;
    private volatile boolean stopped = false;
    private volatile Exception startFailure;

    public void add(LogMessage... messages) {
        this.messages.addAll(Arrays.asList(messages));
    }

    public void failOnStart(Exception failure) {
        startFailure = failure;
    }

    public boolean isStarted() {
        return started;
    }

    public int remaining() {
        return messages.size();
    }

    @Override
    public void start() throws Exception {
        if (startFailure != null) {
            throw startFailure;
        }
        started = true;
    }

    @Override
    public void stop() {
        stopped = true;
    }

    @Override
    public Optional<LogMessage> poll(Duration timeout) throws InterruptedException {
        if (stopped) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean isStopped() {
        return stopped;
    }
}
