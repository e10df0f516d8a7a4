package com.securehealth.domain.schema;

import java.util.Objects;

/**
 * One declared field of a record kind.
 *
 * @param name storage key and projection key
 * @param shape scalar or composite shape
 */
public record FieldDescriptor(String name, FieldShape shape) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shape, "shape");
    }

    public static FieldDescriptor scalar(String name) {
        return new FieldDescriptor(name, FieldShape.SCALAR);
    }

    public static FieldDescriptor list(String name) {
        return new FieldDescriptor(name, FieldShape.LIST);
    }

    public static FieldDescriptor map(String name) {
        return new FieldDescriptor(name, FieldShape.MAP);
    }
}
