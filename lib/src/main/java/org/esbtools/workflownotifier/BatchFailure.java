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

import java.util.Objects;
import java.util.Optional;

/**
 * A batch which failed as a whole, for instance because the backend was unreachable even after the
 * sink's own retries. The status is classified like an item status to decide what happens to each
 * request in the batch.
 */
public final class BatchFailure {
    private final int status;
    private final String details;
    private final Optional<Throwable> cause;

    public BatchFailure(int status, String details, Optional<Throwable> cause) {
        this.status = status;
        this.details = Objects.requireNonNull(details, "details");
        this.cause = Objects.requireNonNull(cause, "cause");
    }

    public BatchFailure(int status, String details) {
        this(status, details, Optional.empty());
    }

    public int status() {
        return status;
    }

    public String details() {
        return details;
    }

    public Optional<Throwable> cause() {
        return cause;
    }

    @Override
    public String toString() {
        return "BatchFailure{" +
                "status=" + status +
                ", details='" + details + '\'' +
                ", cause=" + cause +
                '}';
    }
}
