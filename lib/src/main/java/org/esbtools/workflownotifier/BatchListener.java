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

package org.esbtools.workflownotifier;

import java.util.List;

/**
 * Observes the batches a {@link BatchSink} performs. Called on the sink's threads, concurrently
 * with new submissions and with other batches.
 */
public interface BatchListener<R> {
    /**
     * @param executionId Increases with every batch the sink attempts.
     */
    void beforeBatch(long executionId, List<R> requests);

    /**
     * @param result Either one item result per request, positionally, or a failure of the batch as
     *               a whole.
     */
    void afterBatch(long executionId, List<R> requests, BatchResult result);
}
