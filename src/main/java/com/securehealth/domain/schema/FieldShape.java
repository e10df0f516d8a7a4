package com.securehealth.domain.schema;

import com.securehealth.domain.model.FieldValue;

/**
 * Declared shape of a record field. Composite shapes go through the canonicalizer
 * before encryption and are decanonicalized after decryption.
 */
public enum FieldShape {

    SCALAR(null),
    LIST(FieldValue.ListValue.empty()),
    MAP(FieldValue.MapValue.empty());

    private final FieldValue emptyValue;

    FieldShape(FieldValue emptyValue) {
        this.emptyValue = emptyValue;
    }

    public boolean isComposite() {
        return this != SCALAR;
    }

    /**
     * Typed default substituted when the field is absent or unreadable:
     * {@code null} for scalars, an empty composite otherwise.
     */
    public FieldValue emptyValue() {
        return emptyValue;
    }

    public boolean accepts(FieldValue value) {
        return switch (this) {
            case SCALAR -> value instanceof FieldValue.Scalar;
            case LIST -> value instanceof FieldValue.ListValue;
            case MAP -> value instanceof FieldValue.MapValue;
        };
    }
}
