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
 * Correlates in-flight work back to where it came from, keyed by an identity key.
 *
 * <p>There is at most one value per key at any time. All operations are atomic per key and safe to
 * call from many threads at once; there is intentionally no way to iterate the table.
 *
 * @param <V> The type of in-flight bookkeeping stored per key.
 */
public interface DispatchTable<V> {
    /**
     * Inserts {@code value} under {@code key} if there is no value for that key yet.
     *
     * <p>Otherwise the existing value is left alone and {@code onDuplicate} is called with it,
     * synchronously and before this method returns. No other thread can remove the existing value
     * while the callback runs.
     */
    PutResult<V> putIfAbsent(String key, V value, DuplicateHandler<? super V> onDuplicate);

    Optional<V> get(String key);

    /**
     * Removes and returns the value for {@code key}, if any. Of many threads removing the same key,
     * only one gets the value.
     */
    Optional<V> remove(String key);

    /**
     * Removes the value for {@code key} only if it is {@code value} (by identity).
     */
    boolean remove(String key, V value);

    int size();

    /**
     * Drops every entry. Used when the owner shuts down; entries dropped here are abandoned.
     *
     * @return The number of entries dropped.
     */
    int clear();

    interface DuplicateHandler<V> {
        void onDuplicate(String key, V existing);
    }

    final class PutResult<V> {
        private final V value;
        private final boolean duplicate;

        PutResult(V value, boolean duplicate) {
            this.value = value;
            this.duplicate = duplicate;
        }

        public static <V> PutResult<V> inserted(V value) {
            return new PutResult<>(value, false);
        }

        public static <V> PutResult<V> duplicateOf(V existing) {
            return new PutResult<>(existing, true);
        }

        /**
         * The value now stored under the key: the newly inserted one, or the existing one if this
         * was a duplicate.
         */
        public V value() {
            return value;
        }

        public boolean wasDuplicate() {
            return duplicate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PutResult<?> putResult = (PutResult<?>) o;
            return duplicate == putResult.duplicate &&
                    Objects.equals(value, putResult.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, duplicate);
        }

        @Override
        public String toString() {
            return "PutResult{" +
                    "value=" + value +
                    ", duplicate=" + duplicate +
                    '}';
        }
    }
}
