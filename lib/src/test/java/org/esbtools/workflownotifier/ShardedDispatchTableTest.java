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

import com.google.common.truth.Truth;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@RunWith(JUnit4.class)
public class ShardedDispatchTableTest {
    ShardedDispatchTable<String> table = new ShardedDispatchTable<>(16);

    AtomicInteger duplicateCallbacks = new AtomicInteger(0);

    DispatchTable.DuplicateHandler<String> countDuplicates =
            (key, existing) -> duplicateCallbacks.incrementAndGet();

    @Test
    public void shouldInsertValueForNewKey() {
        DispatchTable.PutResult<String> result = table.putIfAbsent("a", "first", countDuplicates);

        Truth.assertThat(result.wasDuplicate()).isFalse();
        Truth.assertThat(result.value()).isEqualTo("first");
        Truth.assertThat(table.get("a")).isEqualTo(Optional.of("first"));
        Truth.assertThat(duplicateCallbacks.get()).isEqualTo(0);
    }

    @Test
    public void shouldKeepExistingValueAndCallBackWithItOnDuplicateKey() {
        List<String> seenByCallback = new ArrayList<>();
        table.putIfAbsent("a", "first", countDuplicates);

        DispatchTable.PutResult<String> result = table.putIfAbsent("a", "second",
                (key, existing) -> seenByCallback.add(key + "=" + existing));

        Truth.assertThat(result.wasDuplicate()).isTrue();
        Truth.assertThat(result.value()).isEqualTo("first");
        Truth.assertThat(seenByCallback).containsExactly("a=first");
        Truth.assertThat(table.get("a")).isEqualTo(Optional.of("first"));
        Truth.assertThat(table.size()).isEqualTo(1);
    }

    @Test
    public void shouldReturnRemovedValueOnlyOnce() {
        table.putIfAbsent("a", "first", countDuplicates);

        Truth.assertThat(table.remove("a")).isEqualTo(Optional.of("first"));
        Truth.assertThat(table.remove("a")).isEqualTo(Optional.empty());
        Truth.assertThat(table.size()).isEqualTo(0);
    }

    @Test
    public void shouldAcceptKeyAgainOnceRemoved() {
        table.putIfAbsent("a", "first", countDuplicates);
        table.remove("a");

        DispatchTable.PutResult<String> result = table.putIfAbsent("a", "second", countDuplicates);

        Truth.assertThat(result.wasDuplicate()).isFalse();
        Truth.assertThat(table.get("a")).isEqualTo(Optional.of("second"));
    }

    @Test
    public void shouldOnlyRemoveIdenticalValueWhenRemovingByValue() {
        String first = new String("value");
        String lookalike = new String("value");
        table.putIfAbsent("a", first, countDuplicates);

        Truth.assertThat(table.remove("a", lookalike)).isFalse();
        Truth.assertThat(table.size()).isEqualTo(1);

        Truth.assertThat(table.remove("a", first)).isTrue();
        Truth.assertThat(table.size()).isEqualTo(0);
    }

    @Test
    public void shouldCountAcrossShardsAndReportHowManyWereCleared() {
        for (int i = 0; i < 100; i++) {
            table.putIfAbsent("key-" + i, "value-" + i, countDuplicates);
        }

        Truth.assertThat(table.size()).isEqualTo(100);
        Truth.assertThat(table.clear()).isEqualTo(100);
        Truth.assertThat(table.size()).isEqualTo(0);
    }

    @Test
    public void shouldPickSameShardForSameKeyRegardlessOfHistory() {
        ShardedDispatchTable<String> other = new ShardedDispatchTable<>(16);
        for (int i = 0; i < 50; i++) {
            other.putIfAbsent("noise-" + i, "noise", countDuplicates);
        }

        for (int i = 0; i < 50; i++) {
            String key = "0-" + i;
            Truth.assertThat(other.shardIndexOf(key)).isEqualTo(table.shardIndexOf(key));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectNonPositiveShardCount() {
        new ShardedDispatchTable<String>(0);
    }

    @Test(timeout = 10000)
    public void shouldInsertOnceAndCallBackForEveryOtherConcurrentPutOfSameKey() throws Exception {
        int threads = 32;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> duplicates = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                String value = "value-" + i;
                duplicates.add(executor.submit((Callable<Boolean>) () -> {
                    go.await();
                    return table.putIfAbsent("same", value, countDuplicates).wasDuplicate();
                }));
            }

            go.countDown();

            int inserts = 0;
            for (Future<Boolean> duplicate : duplicates) {
                if (!duplicate.get(5, TimeUnit.SECONDS)) {
                    inserts++;
                }
            }

            Truth.assertThat(inserts).isEqualTo(1);
            Truth.assertThat(duplicateCallbacks.get()).isEqualTo(threads - 1);
            Truth.assertThat(table.size()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
