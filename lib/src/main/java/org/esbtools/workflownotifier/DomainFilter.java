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

import com.google.common.collect.ImmutableSet;

import java.util.Collection;

/**
 * Selects the domains a subscriber is notified about. Selecting no domains selects all of them.
 */
public final class DomainFilter {
    private static final DomainFilter ALL = new DomainFilter(ImmutableSet.<String>of());

    private final ImmutableSet<String> selectedDomains;

    private DomainFilter(ImmutableSet<String> selectedDomains) {
        this.selectedDomains = selectedDomains;
    }

    public static DomainFilter allDomains() {
        return ALL;
    }

    public static DomainFilter selecting(Collection<String> domains) {
        return domains.isEmpty() ? ALL : new DomainFilter(ImmutableSet.copyOf(domains));
    }

    public boolean accepts(String domainId) {
        return selectedDomains.isEmpty() || selectedDomains.contains(domainId);
    }

    @Override
    public String toString() {
        return selectedDomains.isEmpty() ? "DomainFilter{all}" : "DomainFilter" + selectedDomains;
    }
}
