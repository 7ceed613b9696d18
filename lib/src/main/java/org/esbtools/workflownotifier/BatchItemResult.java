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
 * The backend's verdict on one request of a batch.
 */
public final class BatchItemResult {
    private final int status;
    private final Optional<String> error;

    public BatchItemResult(int status, Optional<String> error) {
        this.status = status;
        this.error = Objects.requireNonNull(error, "error");
    }

    public static BatchItemResult ofStatus(int status) {
        return new BatchItemResult(status, Optional.empty());
    }

    public static BatchItemResult ofError(int status, String error) {
        return new BatchItemResult(status, Optional.of(error));
    }

    public int status() {
        return status;
    }

    public Optional<String> error() {
        return error;
    }

    @Override
    public String toString() {
        return "BatchItemResult{" +
                "status=" + status +
                ", error=" + error +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatchItemResult that = (BatchItemResult) o;
        return status == that.status &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, error);
    }
}
