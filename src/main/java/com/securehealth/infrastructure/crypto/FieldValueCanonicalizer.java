package com.securehealth.infrastructure.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.schema.FieldShape;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts composite field values to and from their canonical JSON text.
 *
 * <p>Canonical form: object keys sorted, no insignificant whitespace, timestamps as
 * {@code {"$date":"<ISO-8601>"}} and object ids as {@code {"$oid":"<hex>"}}. Equal composites
 * therefore always produce the same text, which deterministic encryption relies on.
 *
 * <p>Map keys starting with {@code $} are written with one more leading {@code $}, so a user key
 * never reads back as a typed scalar.
 */
public class FieldValueCanonicalizer {

    private static final String DATE_KEY = "$date";
    private static final String OID_KEY = "$oid";
    private static final String KEY_ESCAPE = "$";

    private final ObjectMapper objectMapper;

    public FieldValueCanonicalizer() {
        this(new ObjectMapper());
    }

    public FieldValueCanonicalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /**
     * Scalars pass through; composites become their canonical {@link FieldValue.Text}.
     */
    public FieldValue.Scalar canonicalize(FieldValue value) {
        if (value instanceof FieldValue.Scalar scalar) {
            return scalar;
        }
        try {
            return new FieldValue.Text(objectMapper.writeValueAsString(toJson(value)));
        } catch (JsonProcessingException e) {
            throw new EncryptionFailureException("Composite value could not be canonicalized", e);
        }
    }

    /**
     * Restores a field value of the declared shape. Accepted inputs, in order: a native composite
     * of that shape (legacy unencrypted data), canonical text, or for scalar fields any scalar.
     * {@code null} yields the shape's empty value.
     *
     * @throws SchemaDriftException if the value fits none of the accepted forms
     */
    public FieldValue decanonicalize(FieldValue value, FieldShape shape) {
        if (value == null) {
            return shape.emptyValue();
        }
        if (!shape.isComposite()) {
            if (value instanceof FieldValue.Scalar) {
                return value;
            }
            throw new SchemaDriftException("Expected a scalar but found a composite value");
        }
        if (value instanceof FieldValue.Composite) {
            if (shape.accepts(value)) {
                return value;
            }
            throw new SchemaDriftException("Stored composite does not match declared shape " + shape);
        }
        if (!(value instanceof FieldValue.Text text)) {
            throw new SchemaDriftException("Expected canonical text for " + shape + " but found "
                + value.getClass().getSimpleName());
        }
        FieldValue parsed;
        try {
            parsed = fromJson(objectMapper.readTree(text.value()));
        } catch (JsonProcessingException e) {
            throw new SchemaDriftException("Stored text is not a canonical " + shape + " encoding", e);
        }
        if (!shape.accepts(parsed)) {
            throw new SchemaDriftException("Canonical text decodes to a value that is not a " + shape);
        }
        return parsed;
    }

    private JsonNode toJson(FieldValue value) {
        JsonNodeFactory nodes = objectMapper.getNodeFactory();
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof FieldValue.Text text) {
            return nodes.textNode(text.value());
        }
        if (value instanceof FieldValue.Numeric numeric) {
            return numeric.isIntegral()
                ? nodes.numberNode(numeric.value().longValue())
                : nodes.numberNode(numeric.value().doubleValue());
        }
        if (value instanceof FieldValue.Bool bool) {
            return nodes.booleanNode(bool.value());
        }
        if (value instanceof FieldValue.Timestamp timestamp) {
            ObjectNode node = nodes.objectNode();
            node.put(DATE_KEY, timestamp.value().toString());
            return node;
        }
        if (value instanceof FieldValue.ObjectRef ref) {
            ObjectNode node = nodes.objectNode();
            node.put(OID_KEY, ref.hex());
            return node;
        }
        if (value instanceof FieldValue.ListValue list) {
            ArrayNode array = nodes.arrayNode();
            for (FieldValue element : list.elements()) {
                array.add(toJson(element));
            }
            return array;
        }
        FieldValue.MapValue map = (FieldValue.MapValue) value;
        ObjectNode object = nodes.objectNode();
        new TreeMap<>(map.entries()).forEach((key, entry) -> object.set(escapeKey(key), toJson(entry)));
        return object;
    }

    private FieldValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return new FieldValue.Text(node.textValue());
        }
        if (node.isBoolean()) {
            return new FieldValue.Bool(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new FieldValue.Numeric(node.longValue());
        }
        if (node.isNumber()) {
            return new FieldValue.Numeric(node.doubleValue());
        }
        if (node.isArray()) {
            List<FieldValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromJson(element));
            }
            return new FieldValue.ListValue(elements);
        }
        if (node.isObject()) {
            FieldValue special = fromExtendedJson(node);
            if (special != null) {
                return special;
            }
            Map<String, FieldValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(unescapeKey(field.getKey()), fromJson(field.getValue()));
            }
            return new FieldValue.MapValue(entries);
        }
        throw new SchemaDriftException("Unsupported canonical node type: " + node.getNodeType());
    }

    private FieldValue fromExtendedJson(JsonNode node) {
        if (node.size() != 1) {
            return null;
        }
        JsonNode date = node.get(DATE_KEY);
        if (date != null && date.isTextual()) {
            try {
                return new FieldValue.Timestamp(Instant.parse(date.textValue()));
            } catch (DateTimeParseException e) {
                throw new SchemaDriftException("Malformed canonical timestamp", e);
            }
        }
        JsonNode oid = node.get(OID_KEY);
        if (oid != null && oid.isTextual()) {
            try {
                return new FieldValue.ObjectRef(oid.textValue());
            } catch (IllegalArgumentException e) {
                throw new SchemaDriftException("Malformed canonical object id", e);
            }
        }
        return null;
    }

    private static String escapeKey(String key) {
        return key.startsWith(KEY_ESCAPE) ? KEY_ESCAPE + key : key;
    }

    private static String unescapeKey(String key) {
        return key.startsWith(KEY_ESCAPE + KEY_ESCAPE) ? key.substring(KEY_ESCAPE.length()) : key;
    }
}
