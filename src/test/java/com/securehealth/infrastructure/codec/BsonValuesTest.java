package com.securehealth.infrastructure.codec;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.infrastructure.crypto.CipherValue;
import com.securehealth.infrastructure.crypto.DecryptionFailureException;
import com.securehealth.infrastructure.crypto.EncryptionAlgorithm;
import com.securehealth.infrastructure.crypto.ScalarCodec;
import com.securehealth.infrastructure.crypto.SchemaDriftException;
import com.securehealth.infrastructure.crypto.StorageValue;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BsonValuesTest {

    @Test
    void cipherValuesAreStoredAsEncryptedBinary() {
        CipherValue cipher = new CipherValue(EncryptionAlgorithm.RANDOM, UUID.randomUUID(), ScalarCodec.TYPE_STRING,
            new byte[48]);

        Object stored = BsonValues.toBson(new StorageValue.Cipher(cipher));

        Binary binary = assertInstanceOf(Binary.class, stored);
        assertEquals(6, binary.getType());
        assertEquals(new StorageValue.Cipher(cipher), BsonValues.decode(stored));
    }

    @Test
    void classifiesStoredValues() {
        assertNull(BsonValues.decode(null));
        assertEquals(new StorageValue.Plain(new FieldValue.Text("Doe")), BsonValues.decode("Doe"));
        assertEquals(new StorageValue.Plain(new FieldValue.Numeric(3L)), BsonValues.decode(3));
        assertEquals(new StorageValue.LegacyComposite(FieldValue.ListValue.ofTexts(List.of("a", "b"))),
            BsonValues.decode(List.of("a", "b")));
        assertInstanceOf(StorageValue.LegacyComposite.class, BsonValues.decode(new Document("provider", "Acme")));
    }

    @Test
    void convertsDriverNativeTypes() {
        Instant instant = Instant.parse("2024-02-01T08:00:00Z");
        ObjectId id = new ObjectId();

        assertEquals(new FieldValue.Timestamp(instant), BsonValues.fromNative(Date.from(instant)));
        assertEquals(new FieldValue.ObjectRef(id.toHexString()), BsonValues.fromNative(id));
        assertEquals(Date.from(instant), BsonValues.toNative(new FieldValue.Timestamp(instant)));
        assertEquals(id, BsonValues.toNative(new FieldValue.ObjectRef(id.toHexString())));
        assertEquals(new Document("provider", "Acme"),
            BsonValues.toNative(FieldValue.MapValue.ofTexts(Map.of("provider", "Acme"))));
    }

    @Test
    void malformedEncryptedBinaryIsDecryptionFailure() {
        assertThrows(DecryptionFailureException.class, () -> BsonValues.decode(new Binary((byte) 6, new byte[4])));
    }

    @Test
    void unsupportedTypesAreSchemaDrift() {
        assertThrows(SchemaDriftException.class, () -> BsonValues.decode(new Binary((byte) 0, new byte[4])));
    }

    @Test
    void identifiersKeepTheirStoredForm() {
        String hex = new ObjectId().toHexString();

        assertInstanceOf(ObjectId.class, BsonValues.toId(hex));
        assertEquals("patient-42", BsonValues.toId("patient-42"));
        assertEquals(hex, BsonValues.idToString(new ObjectId(hex)));
        assertNull(BsonValues.idToString(null));
    }

    @Test
    void nonFiniteDecimalsBecomeDoubles() {
        assertEquals(new StorageValue.Plain(new FieldValue.Numeric(Double.NaN)), BsonValues.decode(Decimal128.NaN));
        assertEquals(new FieldValue.Numeric(Double.POSITIVE_INFINITY),
            BsonValues.fromNative(Decimal128.POSITIVE_INFINITY));
        assertEquals(new FieldValue.Numeric(-0.0d), BsonValues.fromNative(Decimal128.NEGATIVE_ZERO));
        assertEquals(new FieldValue.Numeric(12.5d), BsonValues.fromNative(Decimal128.parse("12.5")));
    }
}
