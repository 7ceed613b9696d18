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

package org.esbtools.workflownotifier.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

public final class FilterConfig {
    private final List<String> selectedDomains;

    /**
     * @param selectedDomains Domain ids to notify about. Empty or absent means every domain.
     */
    @JsonCreator
    public FilterConfig(@JsonProperty("selectedDomains") List<String> selectedDomains) {
        this.selectedDomains = selectedDomains == null
                ? ImmutableList.<String>of()
                : ImmutableList.copyOf(selectedDomains);
    }

    public static FilterConfig allDomains() {
        return new FilterConfig(null);
    }

    public List<String> getSelectedDomains() {
        return selectedDomains;
    }

    @Override
    public String toString() {
        return "FilterConfig{" +
                "selectedDomains=" + selectedDomains +
                '}';
    }
}
