package com.securehealth.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CipherValueTest {

    private final UUID keyId = UUID.fromString("0f8fad5b-d9cb-469f-a165-70867728950e");

    @Test
    void parsesItsOwnBytes() {
        CipherValue value = new CipherValue(EncryptionAlgorithm.RANDOM, keyId, ScalarCodec.TYPE_STRING, new byte[] {1, 2, 3});

        byte[] bytes = value.toBytes();

        assertEquals(CipherValue.HEADER_LENGTH + 3, bytes.length);
        assertEquals(2, bytes[0]);
        assertEquals(ScalarCodec.TYPE_STRING, bytes[17]);
        assertEquals(value, CipherValue.parse(bytes));
    }

    @Test
    void rejectsUnknownAlgorithmTag() {
        byte[] bytes = new CipherValue(EncryptionAlgorithm.DETERMINISTIC, keyId, ScalarCodec.TYPE_STRING,
            new byte[] {9}).toBytes();
        bytes[0] = 7;

        assertThrows(IllegalArgumentException.class, () -> CipherValue.parse(bytes));
    }

    @Test
    void rejectsHeaderOnlyInput() {
        assertThrows(IllegalArgumentException.class, () -> CipherValue.parse(new byte[CipherValue.HEADER_LENGTH]));
        assertThrows(IllegalArgumentException.class, () -> CipherValue.parse(null));
    }

    @Test
    void requiresAnEncryptingAlgorithm() {
        assertThrows(IllegalArgumentException.class,
            () -> new CipherValue(EncryptionAlgorithm.NONE, keyId, ScalarCodec.TYPE_STRING, new byte[] {1}));
    }

    @Test
    void toStringMasksKeyAndPayload() {
        CipherValue value = new CipherValue(EncryptionAlgorithm.RANDOM, keyId, ScalarCodec.TYPE_STRING, new byte[64]);

        String text = value.toString();

        assertTrue(text.contains("****950e"));
        assertFalse(text.contains(keyId.toString()));
        assertTrue(text.contains("..."));
    }
}
