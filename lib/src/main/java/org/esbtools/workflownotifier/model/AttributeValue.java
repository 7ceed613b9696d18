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

package org.esbtools.workflownotifier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A workflow attribute value: exactly one of a string, an integer, a boolean, or binary data.
 *
 * <p>Serialized with its tag, for example {@code {"type":"INT","intData":42}}, so the variant
 * survives a round trip through JSON. Binary data is base64 encoded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AttributeValue {
    public enum Type {
        STRING,
        INT,
        BOOL,
        BINARY
    }

    private final Type type;
    private final Object data;

    private AttributeValue(Type type, Object data) {
        this.type = type;
        this.data = data;
    }

    public static AttributeValue ofString(String value) {
        return new AttributeValue(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue ofInt(long value) {
        return new AttributeValue(Type.INT, value);
    }

    public static AttributeValue ofBool(boolean value) {
        return new AttributeValue(Type.BOOL, value);
    }

    public static AttributeValue ofBinary(byte[] value) {
        return new AttributeValue(Type.BINARY, Objects.requireNonNull(value, "value").clone());
    }

    @JsonCreator
    static AttributeValue fromJson(
            @JsonProperty("type") Type type,
            @JsonProperty("stringData") String stringData,
            @JsonProperty("intData") Long intData,
            @JsonProperty("boolData") Boolean boolData,
            @JsonProperty("binaryData") byte[] binaryData) {
        if (type == null) {
            throw new IllegalArgumentException("Attribute value is missing its type");
        }

        switch (type) {
            case STRING:
                return ofString(requireData(stringData, "stringData", type));
            case INT:
                return ofInt(requireData(intData, "intData", type));
            case BOOL:
                return ofBool(requireData(boolData, "boolData", type));
            case BINARY:
                return ofBinary(requireData(binaryData, "binaryData", type));
            default:
                throw new IllegalArgumentException("Unknown attribute type " + type);
        }
    }

    @JsonProperty("type")
    public Type type() {
        return type;
    }

    public String asString() {
        return (String) dataOf(Type.STRING);
    }

    public long asInt() {
        return (Long) dataOf(Type.INT);
    }

    public boolean asBool() {
        return (Boolean) dataOf(Type.BOOL);
    }

    public byte[] asBinary() {
        return ((byte[]) dataOf(Type.BINARY)).clone();
    }

    @JsonProperty("stringData")
    String stringData() {
        return type == Type.STRING ? (String) data : null;
    }

    @JsonProperty("intData")
    Long intData() {
        return type == Type.INT ? (Long) data : null;
    }

    @JsonProperty("boolData")
    Boolean boolData() {
        return type == Type.BOOL ? (Boolean) data : null;
    }

    @JsonProperty("binaryData")
    byte[] binaryData() {
        return type == Type.BINARY ? (byte[]) data : null;
    }

    private Object dataOf(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Attribute is " + type + ", not " + expected);
        }
        return data;
    }

    private static <T> T requireData(T data, String property, Type type) {
        if (data == null) {
            throw new IllegalArgumentException(
                    "Attribute of type " + type + " is missing '" + property + "'");
        }
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeValue that = (AttributeValue) o;
        if (type != that.type) return false;
        if (type == Type.BINARY) {
            return Arrays.equals((byte[]) data, (byte[]) that.data);
        }
        return data.equals(that.data);
    }

    @Override
    public int hashCode() {
        if (type == Type.BINARY) {
            return 31 * type.hashCode() + Arrays.hashCode((byte[]) data);
        }
        return Objects.hash(type, data);
    }

    @Override
    public String toString() {
        String value = type == Type.BINARY
                ? new String((byte[]) data, StandardCharsets.UTF_8)
                : String.valueOf(data);
        return type + "(" + value + ")";
    }
}
