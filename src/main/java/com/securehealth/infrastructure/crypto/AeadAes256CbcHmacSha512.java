package com.securehealth.infrastructure.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AEAD_AES_256_CBC_HMAC_SHA_512 authenticated encryption.
 *
 * <p>Key layout (96 bytes):
 * <ul>
 *   <li>bytes 0-31: HMAC-SHA-512 MAC key</li>
 *   <li>bytes 32-63: AES-256 encryption key</li>
 *   <li>bytes 64-95: IV derivation key (deterministic mode only)</li>
 * </ul>
 *
 * <p>Output: {@code IV(16) || AES-256-CBC(P) || T(32)} where
 * {@code T = HMAC-SHA-512(macKey, AD || IV || C || bitLength(AD))} truncated to 32 bytes.
 * Deterministic mode derives the IV as {@code HMAC-SHA-512(ivKey, AD || P)} truncated to 16 bytes,
 * so equal (key, AD, plaintext) always give byte-identical output. Random mode draws the IV from
 * {@link SecureRandom} on every call.
 *
 * <p>Thread-safe: JCA objects are created per call.
 *
 * @author Security Team
 * @since 1.0.0
 */
public final class AeadAes256CbcHmacSha512 {

    public static final int KEY_LENGTH = 96;
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 32;

    private static final int SUBKEY_LENGTH = 32;
    private static final int MIN_CIPHERTEXT_LENGTH = IV_LENGTH + 16 + TAG_LENGTH;

    private final SecureRandom secureRandom;

    public AeadAes256CbcHmacSha512() {
        this(new SecureRandom());
    }

    public AeadAes256CbcHmacSha512(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public byte[] encrypt(byte[] key, byte[] plaintext, byte[] associatedData, boolean deterministic)
            throws GeneralSecurityException {
        checkKey(key);
        byte[] iv = deterministic
            ? deriveIv(key, plaintext, associatedData)
            : randomIv();

        Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
        cipher.init(Cipher.ENCRYPT_MODE, encryptionKey(key), new IvParameterSpec(iv));
        byte[] ciphertext = cipher.doFinal(plaintext);

        byte[] tag = tag(key, associatedData, iv, ciphertext);

        return ByteBuffer.allocate(iv.length + ciphertext.length + tag.length)
            .put(iv)
            .put(ciphertext)
            .put(tag)
            .array();
    }

    /**
     * @throws AEADBadTagException if the tag does not verify (wrong key, tampering, wrong AD)
     */
    public byte[] decrypt(byte[] key, byte[] input, byte[] associatedData) throws GeneralSecurityException {
        checkKey(key);
        if (input == null || input.length < MIN_CIPHERTEXT_LENGTH) {
            throw new AEADBadTagException("Ciphertext too short");
        }

        byte[] iv = Arrays.copyOfRange(input, 0, IV_LENGTH);
        byte[] ciphertext = Arrays.copyOfRange(input, IV_LENGTH, input.length - TAG_LENGTH);
        byte[] actualTag = Arrays.copyOfRange(input, input.length - TAG_LENGTH, input.length);

        byte[] expectedTag = tag(key, associatedData, iv, ciphertext);
        if (!MessageDigest.isEqual(expectedTag, actualTag)) {
            throw new AEADBadTagException("Authentication tag mismatch");
        }

        Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
        cipher.init(Cipher.DECRYPT_MODE, encryptionKey(key), new IvParameterSpec(iv));
        return cipher.doFinal(ciphertext);
    }

    /** Fresh random key material of {@link #KEY_LENGTH} bytes. */
    public byte[] generateKey() {
        byte[] key = new byte[KEY_LENGTH];
        secureRandom.nextBytes(key);
        return key;
    }

    private byte[] deriveIv(byte[] key, byte[] plaintext, byte[] associatedData) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA512");
        mac.init(new SecretKeySpec(key, 2 * SUBKEY_LENGTH, SUBKEY_LENGTH, "HmacSHA512"));
        mac.update(associatedData);
        mac.update(plaintext);
        return Arrays.copyOf(mac.doFinal(), IV_LENGTH);
    }

    private byte[] randomIv() {
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        return iv;
    }

    private byte[] tag(byte[] key, byte[] associatedData, byte[] iv, byte[] ciphertext)
            throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA512");
        mac.init(new SecretKeySpec(key, 0, SUBKEY_LENGTH, "HmacSHA512"));
        mac.update(associatedData);
        mac.update(iv);
        mac.update(ciphertext);
        mac.update(ByteBuffer.allocate(Long.BYTES).putLong((long) associatedData.length * 8).array());
        return Arrays.copyOf(mac.doFinal(), TAG_LENGTH);
    }

    private static SecretKeySpec encryptionKey(byte[] key) {
        return new SecretKeySpec(key, SUBKEY_LENGTH, SUBKEY_LENGTH, "AES");
    }

    private static void checkKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("AEAD key must be " + KEY_LENGTH + " bytes");
        }
    }
}
