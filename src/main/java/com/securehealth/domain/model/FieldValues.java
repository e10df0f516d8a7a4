package com.securehealth.domain.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers used by record schemas when assembling typed records.
 *
 * <p>Every reader returns the caller's default instead of throwing when the value is absent or
 * of an unexpected kind; schema drift is reported upstream by the codec, not here.
 */
public final class FieldValues {

    private FieldValues() {
        // utility class
    }

    public static String text(Map<String, FieldValue> fields, String name) {
        return asText(fields.get(name));
    }

    public static String asText(FieldValue value) {
        if (value instanceof FieldValue.Text text) {
            return text.value();
        }
        if (value instanceof FieldValue.ObjectRef ref) {
            return ref.hex();
        }
        if (value instanceof FieldValue.Numeric numeric) {
            return numeric.value().toString();
        }
        if (value instanceof FieldValue.Bool bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof FieldValue.Timestamp timestamp) {
            return timestamp.value().toString();
        }
        return null;
    }

    public static Instant instant(Map<String, FieldValue> fields, String name) {
        return asInstant(fields.get(name));
    }

    public static Instant asInstant(FieldValue value) {
        if (value instanceof FieldValue.Timestamp timestamp) {
            return timestamp.value();
        }
        if (value instanceof FieldValue.Text text) {
            try {
                return Instant.parse(text.value());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        if (value instanceof FieldValue.Numeric numeric && numeric.isIntegral()) {
            return Instant.ofEpochMilli(numeric.value().longValue());
        }
        return null;
    }

    /**
     * Reads an identifier reference; accepts both the native id kind and its hex text form.
     */
    public static String objectRef(Map<String, FieldValue> fields, String name) {
        FieldValue value = fields.get(name);
        if (value instanceof FieldValue.ObjectRef ref) {
            return ref.hex();
        }
        if (value instanceof FieldValue.Text text && text.value().matches("^[0-9a-fA-F]{24}$")) {
            return text.value().toLowerCase();
        }
        return null;
    }

    public static long longValue(Map<String, FieldValue> fields, String name, long defaultValue) {
        FieldValue value = fields.get(name);
        if (value instanceof FieldValue.Numeric numeric) {
            return numeric.value().longValue();
        }
        if (value instanceof FieldValue.Text text) {
            try {
                return Long.parseLong(text.value());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static boolean bool(Map<String, FieldValue> fields, String name, boolean defaultValue) {
        FieldValue value = fields.get(name);
        if (value instanceof FieldValue.Bool bool) {
            return bool.value();
        }
        if (value instanceof FieldValue.Text text) {
            return Boolean.parseBoolean(text.value());
        }
        return defaultValue;
    }

    public static List<String> textList(Map<String, FieldValue> fields, String name) {
        List<String> result = new ArrayList<>();
        if (fields.get(name) instanceof FieldValue.ListValue list) {
            for (FieldValue element : list.elements()) {
                String text = asText(element);
                if (text != null) {
                    result.add(text);
                }
            }
        }
        return result;
    }

    public static Map<String, String> textMap(Map<String, FieldValue> fields, String name) {
        FieldValue value = fields.get(name);
        if (!(value instanceof FieldValue.MapValue map)) {
            return null;
        }
        Map<String, String> result = new LinkedHashMap<>();
        map.entries().forEach((key, entry) -> result.put(key, asText(entry)));
        return result;
    }

    public static List<FieldValue.MapValue> mapList(Map<String, FieldValue> fields, String name) {
        List<FieldValue.MapValue> result = new ArrayList<>();
        if (fields.get(name) instanceof FieldValue.ListValue list) {
            for (FieldValue element : list.elements()) {
                if (element instanceof FieldValue.MapValue map) {
                    result.add(map);
                }
            }
        }
        return result;
    }

    public static void putIfPresent(Map<String, FieldValue> fields, String name, FieldValue value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
