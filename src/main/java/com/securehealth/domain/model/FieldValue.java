package com.securehealth.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed union of the values a PHI record field can hold.
 *
 * <p>Scalars: {@link Text}, {@link Numeric}, {@link Bool}, {@link Timestamp}, {@link ObjectRef}.
 * Composites: {@link ListValue} (ordered) and {@link MapValue} (string keys, insertion order kept).
 *
 * <p>Canonical encoding, storage conversion and projection are all defined over this union only;
 * no code path inspects raw {@code Object} values after the storage boundary.
 *
 * @author Security Team
 * @since 1.0.0
 */
public sealed interface FieldValue permits FieldValue.Scalar, FieldValue.Composite {

    /**
     * Converts to plain Java values (String, Long, Double, Boolean, Instant, List, Map)
     * for serialization to callers.
     */
    Object toPlain();

    sealed interface Scalar extends FieldValue permits Text, Numeric, Bool, Timestamp, ObjectRef {
    }

    sealed interface Composite extends FieldValue permits ListValue, MapValue {
        boolean isEmpty();
    }

    record Text(String value) implements Scalar {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    /**
     * Integral numbers are held as {@link Long}, everything else as {@link Double}.
     */
    record Numeric(Number value) implements Scalar {
        public Numeric {
            Objects.requireNonNull(value, "value");
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                value = value.longValue();
            } else if (!(value instanceof Long) && !(value instanceof Double)) {
                value = value.doubleValue();
            }
        }

        public boolean isIntegral() {
            return value instanceof Long;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Bool(boolean value) implements Scalar {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    /**
     * Millisecond precision, matching the store's date type.
     */
    record Timestamp(Instant value) implements Scalar {
        public Timestamp {
            Objects.requireNonNull(value, "value");
            value = Instant.ofEpochMilli(value.toEpochMilli());
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    /**
     * Store-native identifier, held as its 24-character hex form.
     */
    record ObjectRef(String hex) implements Scalar {
        public ObjectRef {
            Objects.requireNonNull(hex, "hex");
            if (!hex.matches("^[0-9a-fA-F]{24}$")) {
                throw new IllegalArgumentException("Object id must be 24 hex characters");
            }
            hex = hex.toLowerCase();
        }

        @Override
        public Object toPlain() {
            return hex;
        }
    }

    record ListValue(List<FieldValue> elements) implements Composite {
        public ListValue {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public static ListValue empty() {
            return new ListValue(List.of());
        }

        public static ListValue ofTexts(List<String> texts) {
            List<FieldValue> values = new ArrayList<>(texts.size());
            for (String text : texts) {
                values.add(new Text(text));
            }
            return new ListValue(values);
        }

        @Override
        public boolean isEmpty() {
            return elements.isEmpty();
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>(elements.size());
            for (FieldValue element : elements) {
                plain.add(element == null ? null : element.toPlain());
            }
            return plain;
        }
    }

    record MapValue(Map<String, FieldValue> entries) implements Composite {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public static MapValue empty() {
            return new MapValue(Map.of());
        }

        public static MapValue ofTexts(Map<String, String> texts) {
            Map<String, FieldValue> values = new LinkedHashMap<>();
            texts.forEach((key, text) -> values.put(key, text == null ? null : new Text(text)));
            return new MapValue(values);
        }

        public FieldValue get(String key) {
            return entries.get(key);
        }

        @Override
        public boolean isEmpty() {
            return entries.isEmpty();
        }

        @Override
        public Object toPlain() {
            Map<String, Object> plain = new LinkedHashMap<>();
            entries.forEach((key, value) -> plain.put(key, value == null ? null : value.toPlain()));
            return plain;
        }
    }

    static Text text(String value) {
        return value == null ? null : new Text(value);
    }

    static Timestamp timestamp(Instant value) {
        return value == null ? null : new Timestamp(value);
    }

    static ObjectRef objectRef(String hex) {
        return hex == null ? null : new ObjectRef(hex);
    }
}
