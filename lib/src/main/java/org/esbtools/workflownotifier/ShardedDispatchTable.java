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

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link DispatchTable} split into independently locked shards, so many workers submitting and
 * many completion callbacks resolving do not all contend on one lock.
 *
 * <p>The shard of a key depends only on the key and the shard count.
 */
@ThreadSafe
public class ShardedDispatchTable<V> implements DispatchTable<V> {
    private final List<Map<String, V>> shards;

    private static final HashFunction SHARD_HASH = Hashing.murmur3_32_fixed();

    public static final int DEFAULT_SHARD_COUNT = 1024;

    public ShardedDispatchTable() {
        this(DEFAULT_SHARD_COUNT);
    }

    public ShardedDispatchTable(int shardCount) {
        Preconditions.checkArgument(shardCount > 0, "shardCount must be positive but was %s",
                shardCount);

        List<Map<String, V>> shards = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            shards.add(new HashMap<>());
        }
        this.shards = shards;
    }

    @Override
    public PutResult<V> putIfAbsent(String key, V value, DuplicateHandler<? super V> onDuplicate) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(onDuplicate, "onDuplicate");

        Map<String, V> shard = shardFor(key);

        synchronized (shard) {
            V existing = shard.get(key);

            if (existing != null) {
                onDuplicate.onDuplicate(key, existing);
                return PutResult.duplicateOf(existing);
            }

            shard.put(key, value);
            return PutResult.inserted(value);
        }
    }

    @Override
    public Optional<V> get(String key) {
        Map<String, V> shard = shardFor(key);

        synchronized (shard) {
            return Optional.ofNullable(shard.get(key));
        }
    }

    @Override
    public Optional<V> remove(String key) {
        Map<String, V> shard = shardFor(key);

        synchronized (shard) {
            return Optional.ofNullable(shard.remove(key));
        }
    }

    @Override
    public boolean remove(String key, V value) {
        Map<String, V> shard = shardFor(key);

        synchronized (shard) {
            if (shard.get(key) != value) {
                return false;
            }
            shard.remove(key);
            return true;
        }
    }

    @Override
    public int size() {
        int size = 0;
        for (Map<String, V> shard : shards) {
            synchronized (shard) {
                size += shard.size();
            }
        }
        return size;
    }

    @Override
    public int clear() {
        int cleared = 0;
        for (Map<String, V> shard : shards) {
            synchronized (shard) {
                cleared += shard.size();
                shard.clear();
            }
        }
        return cleared;
    }

    int shardIndexOf(String key) {
        int hash = SHARD_HASH.hashString(key, StandardCharsets.UTF_8).asInt();
        return Math.floorMod(hash, shards.size());
    }

    private Map<String, V> shardFor(String key) {
        return shards.get(shardIndexOf(Objects.requireNonNull(key, "key")));
    }

    @Override
    public String toString() {
        return "ShardedDispatchTable{" +
                "shards=" + shards.size() +
                '}';
    }
}
