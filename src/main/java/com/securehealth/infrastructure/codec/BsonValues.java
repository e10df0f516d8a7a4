package com.securehealth.infrastructure.codec;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.infrastructure.crypto.CipherValue;
import com.securehealth.infrastructure.crypto.DecryptionFailureException;
import com.securehealth.infrastructure.crypto.SchemaDriftException;
import com.securehealth.infrastructure.crypto.StorageValue;
import org.bson.BsonBinarySubType;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between {@link FieldValue}/{@link StorageValue} and the driver's native document values.
 *
 * <p>This is the only place raw stored values are inspected: {@link #decode(Object)} classifies a
 * stored value once, after which callers match on {@link StorageValue}.
 */
public final class BsonValues {

    private static final byte ENCRYPTED_SUBTYPE = BsonBinarySubType.ENCRYPTED.getValue();

    private BsonValues() {
        // utility class
    }

    public static Object toBson(StorageValue value) {
        if (value == null) {
            return null;
        }
        if (value instanceof StorageValue.Cipher cipher) {
            return new Binary(ENCRYPTED_SUBTYPE, cipher.value().toBytes());
        }
        if (value instanceof StorageValue.LegacyComposite legacy) {
            return toNative(legacy.value());
        }
        return toNative(((StorageValue.Plain) value).value());
    }

    public static Object toNative(FieldValue value) {
        if (value == null) {
            return null;
        }
        if (value instanceof FieldValue.Text text) {
            return text.value();
        }
        if (value instanceof FieldValue.Numeric numeric) {
            return numeric.value();
        }
        if (value instanceof FieldValue.Bool bool) {
            return bool.value();
        }
        if (value instanceof FieldValue.Timestamp timestamp) {
            return Date.from(timestamp.value());
        }
        if (value instanceof FieldValue.ObjectRef ref) {
            return new ObjectId(ref.hex());
        }
        if (value instanceof FieldValue.ListValue list) {
            List<Object> elements = new ArrayList<>(list.elements().size());
            for (FieldValue element : list.elements()) {
                elements.add(toNative(element));
            }
            return elements;
        }
        Document document = new Document();
        ((FieldValue.MapValue) value).entries().forEach((key, entry) -> document.put(key, toNative(entry)));
        return document;
    }

    /**
     * Classifies a stored value.
     *
     * @return {@code null} for a stored {@code null}
     * @throws DecryptionFailureException if an encrypted binary is malformed
     * @throws SchemaDriftException if the value has no field value representation
     */
    public static StorageValue decode(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Binary binary && binary.getType() == ENCRYPTED_SUBTYPE) {
            try {
                return new StorageValue.Cipher(CipherValue.parse(binary.getData()));
            } catch (IllegalArgumentException e) {
                throw new DecryptionFailureException("Malformed cipher value", e);
            }
        }
        FieldValue value = fromNative(raw);
        if (value instanceof FieldValue.Composite composite) {
            return new StorageValue.LegacyComposite(composite);
        }
        return new StorageValue.Plain(value);
    }

    public static FieldValue fromNative(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String text) {
            return new FieldValue.Text(text);
        }
        if (raw instanceof Boolean bool) {
            return new FieldValue.Bool(bool);
        }
        if (raw instanceof Decimal128 decimal) {
            return new FieldValue.Numeric(decimal.doubleValue());
        }
        if (raw instanceof Number number) {
            return new FieldValue.Numeric(number);
        }
        if (raw instanceof Date date) {
            return new FieldValue.Timestamp(date.toInstant());
        }
        if (raw instanceof Instant instant) {
            return new FieldValue.Timestamp(instant);
        }
        if (raw instanceof ObjectId objectId) {
            return new FieldValue.ObjectRef(objectId.toHexString());
        }
        if (raw instanceof List<?> list) {
            List<FieldValue> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                elements.add(fromNative(element));
            }
            return new FieldValue.ListValue(elements);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, FieldValue> entries = new LinkedHashMap<>();
            map.forEach((key, entry) -> entries.put(String.valueOf(key), fromNative(entry)));
            return new FieldValue.MapValue(entries);
        }
        throw new SchemaDriftException("Unsupported stored value type " + raw.getClass().getSimpleName());
    }

    /** Stored identifier: an {@code ObjectId} for 24-hex ids, the string otherwise. */
    public static Object toId(String id) {
        return ObjectId.isValid(id) ? new ObjectId(id) : id;
    }

    public static String idToString(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        return raw.toString();
    }
}
