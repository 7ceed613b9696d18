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

import com.google.common.truth.Truth;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Duration;

@RunWith(JUnit4.class)
public class ExponentialBackoffTest {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(200),
            Duration.ofSeconds(20));

    @Test
    public void shouldDoubleDelayWithEveryAttempt() {
        Truth.assertThat(backoff.delay(0)).isEqualTo(Duration.ofMillis(200));
        Truth.assertThat(backoff.delay(1)).isEqualTo(Duration.ofMillis(400));
        Truth.assertThat(backoff.delay(2)).isEqualTo(Duration.ofMillis(800));
        Truth.assertThat(backoff.delay(6)).isEqualTo(Duration.ofMillis(12800));
    }

    @Test
    public void shouldNeverExceedMaxDelay() {
        Truth.assertThat(backoff.delay(7)).isEqualTo(Duration.ofSeconds(20));
        Truth.assertThat(backoff.delay(1000)).isEqualTo(Duration.ofSeconds(20));
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectMaxBelowInitial() {
        new ExponentialBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1));
    }
}
