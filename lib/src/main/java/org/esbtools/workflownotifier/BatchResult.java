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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one batch attempt: per-item results, or a batch level failure.
 */
public final class BatchResult {
    private final List<BatchItemResult> items;
    private final Optional<BatchFailure> failure;

    private BatchResult(List<BatchItemResult> items, Optional<BatchFailure> failure) {
        this.items = items;
        this.failure = failure;
    }

    public static BatchResult completed(List<BatchItemResult> items) {
        return new BatchResult(
                Collections.unmodifiableList(Objects.requireNonNull(items, "items")),
                Optional.empty());
    }

    public static BatchResult failed(BatchFailure failure) {
        return new BatchResult(Collections.emptyList(),
                Optional.of(Objects.requireNonNull(failure, "failure")));
    }

    /**
     * Results in the same order as the batch's requests. Empty if the batch {@link #failure()
     * failed}.
     */
    public List<BatchItemResult> items() {
        return items;
    }

    public Optional<BatchFailure> failure() {
        return failure;
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "items=" + items +
                ", failure=" + failure +
                '}';
    }
}
