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

@RunWith(JUnit4.class)
public class StatusClassTest {
    @Test
    public void shouldTreatOkCodesAsSuccess() {
        Truth.assertThat(StatusClass.of(200)).isEqualTo(StatusClass.SUCCESS);
        Truth.assertThat(StatusClass.of(201)).isEqualTo(StatusClass.SUCCESS);
        Truth.assertThat(StatusClass.of(299)).isEqualTo(StatusClass.SUCCESS);
    }

    @Test
    public void shouldTreatNotFoundAndConflictAsSuccess() {
        Truth.assertThat(StatusClass.of(404)).isEqualTo(StatusClass.SUCCESS);
        Truth.assertThat(StatusClass.of(409)).isEqualTo(StatusClass.SUCCESS);
    }

    @Test
    public void shouldTreatTransientFailuresAsRetryable() {
        for (int status : new int[]{408, 429, 500, 503, 507}) {
            Truth.assertWithMessage("class of status " + status)
                    .that(StatusClass.of(status)).isEqualTo(StatusClass.RETRYABLE);
            Truth.assertWithMessage("status " + status + " retryable")
                    .that(StatusClass.isRetryable(status)).isTrue();
        }
    }

    @Test
    public void shouldTreatEverythingElseAsPermanent() {
        for (int status : new int[]{0, 100, 199, 300, 400, 401, 403, 413, 501, 502, 504}) {
            Truth.assertWithMessage("class of status " + status)
                    .that(StatusClass.of(status)).isEqualTo(StatusClass.PERMANENT);
        }
    }
}
