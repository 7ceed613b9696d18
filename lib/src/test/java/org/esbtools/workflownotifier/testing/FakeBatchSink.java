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

import org.esbtools.workflownotifier.BatchListener;
import org.esbtools.workflownotifier.BatchSink;
import org.esbtools.workflownotifier.BatchSinkFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records submitted requests and never commits anything on its own. Tests play the backend by
 * calling the {@link #listener()} directly.
 */
public class FakeBatchSink<R> implements BatchSink<R>, BatchSinkFactory<R> {
    private final List<R> submitted = Collections.synchronizedList(new ArrayList<>());
    private volatile BatchListener<R> listener;
    private volatile RuntimeException submitFailure;
    private volatile boolean stopped = false;

    public List<R> submitted() {
        return submitted;
    }

    public BatchListener<R> listener() {
        return listener;
    }

    public boolean isStopped() {
        return stopped;
    }

    public void failOnSubmit(RuntimeException failure) {
        submitFailure = failure;
    }

    @Override
    public BatchSink<R> start(BatchListener<R> listener) {
        this.listener = listener;
        return this;
    }

    @Override
    public void submit(R request) {
        if (submitFailure != null) {
            throw submitFailure;
        }
        if (stopped) {
            throw new IllegalStateException("Fake sink stopped");
        }
        submitted.add(request);
    }

    @Override
    public void stop() {
        stopped = true;
    }
}
