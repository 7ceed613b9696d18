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

package org.esbtools.workflownotifier.elasticsearch;

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * Delays which double with every attempt, up to a maximum.
 */
public final class ExponentialBackoff {
    private final Duration initial;
    private final Duration max;

    public ExponentialBackoff(Duration initial, Duration max) {
        Preconditions.checkArgument(!initial.isNegative() && !initial.isZero(),
                "initial backoff must be positive but was %s", initial);
        Preconditions.checkArgument(max.compareTo(initial) >= 0,
                "max backoff %s is less than initial backoff %s", max, initial);

        this.initial = initial;
        this.max = max;
    }

    /**
     * @param attempt Zero for the delay before the first retry.
     */
    public Duration delay(int attempt) {
        Preconditions.checkArgument(attempt >= 0, "attempt must not be negative");

        // Keeps the shift from overflowing.
        int exponent = Math.min(attempt, 30);
        long millis = initial.toMillis() << exponent;

        if (millis <= 0 || millis > max.toMillis()) {
            return max;
        }

        return Duration.ofMillis(millis);
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{" +
                "initial=" + initial +
                ", max=" + max +
                '}';
    }
}
