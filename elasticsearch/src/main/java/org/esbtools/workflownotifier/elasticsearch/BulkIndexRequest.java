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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code index} action of a bulk request. The document id is also the identity key of the
 * notification the document was built from.
 */
public final class BulkIndexRequest {
    static final String ACTION = "index";

    private final String index;
    private final String id;
    private final JsonNode source;

    private BulkIndexRequest(String index, String id, JsonNode source) {
        this.index = Objects.requireNonNull(index, "index");
        this.id = Objects.requireNonNull(id, "id");
        this.source = Objects.requireNonNull(source, "source");
    }

    public static BulkIndexRequest index(String index, String id, JsonNode source) {
        return new BulkIndexRequest(index, id, source);
    }

    /** Resolves a request back to its identity key. */
    public static Optional<String> keyOf(BulkIndexRequest request) {
        return Optional.ofNullable(request.id);
    }

    public String index() {
        return index;
    }

    public String id() {
        return id;
    }

    public JsonNode source() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BulkIndexRequest that = (BulkIndexRequest) o;
        return Objects.equals(index, that.index) &&
                Objects.equals(id, that.id) &&
                Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, id, source);
    }

    @Override
    public String toString() {
        return "BulkIndexRequest{" +
                "index='" + index + '\'' +
                ", id='" + id + '\'' +
                '}';
    }
}
