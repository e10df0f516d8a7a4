package com.securehealth.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import javax.crypto.AEADBadTagException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AeadAes256CbcHmacSha512Test {

    private final AeadAes256CbcHmacSha512 aead = new AeadAes256CbcHmacSha512();
    private final byte[] key = aead.generateKey();
    private final byte[] ad = "header".getBytes(StandardCharsets.UTF_8);
    private final byte[] plaintext = "Hypertension".getBytes(StandardCharsets.UTF_8);

    @Test
    void deterministicModeIsStable() throws Exception {
        byte[] first = aead.encrypt(key, plaintext, ad, true);
        byte[] second = aead.encrypt(key, plaintext, ad, true);

        assertArrayEquals(first, second);
        assertArrayEquals(plaintext, aead.decrypt(key, first, ad));
    }

    @Test
    void randomModeUsesFreshIv() throws Exception {
        byte[] first = aead.encrypt(key, plaintext, ad, false);
        byte[] second = aead.encrypt(key, plaintext, ad, false);

        assertFalse(java.util.Arrays.equals(first, second));
        assertArrayEquals(plaintext, aead.decrypt(key, first, ad));
        assertArrayEquals(plaintext, aead.decrypt(key, second, ad));
    }

    @Test
    void outputLayoutIsIvCiphertextTag() throws Exception {
        byte[] output = aead.encrypt(key, new byte[0], ad, false);

        // empty plaintext still pads to one AES block
        assertEquals(AeadAes256CbcHmacSha512.IV_LENGTH + 16 + AeadAes256CbcHmacSha512.TAG_LENGTH, output.length);
    }

    @Test
    void tamperedCiphertextIsRejected() throws Exception {
        byte[] output = aead.encrypt(key, plaintext, ad, true);
        output[AeadAes256CbcHmacSha512.IV_LENGTH] ^= 0x01;

        assertThrows(AEADBadTagException.class, () -> aead.decrypt(key, output, ad));
    }

    @Test
    void differentAssociatedDataIsRejected() throws Exception {
        byte[] output = aead.encrypt(key, plaintext, ad, true);

        assertThrows(AEADBadTagException.class,
            () -> aead.decrypt(key, output, "other".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void wrongKeyIsRejected() throws Exception {
        byte[] output = aead.encrypt(key, plaintext, ad, false);

        assertThrows(AEADBadTagException.class, () -> aead.decrypt(aead.generateKey(), output, ad));
    }

    @Test
    void shortInputIsRejected() {
        assertThrows(AEADBadTagException.class, () -> aead.decrypt(key, new byte[10], ad));
    }

    @Test
    void keyLengthIsEnforced() {
        assertThrows(IllegalArgumentException.class, () -> aead.encrypt(new byte[32], plaintext, ad, true));
    }
}
