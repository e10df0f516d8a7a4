package com.securehealth.infrastructure.keyvault;

import com.securehealth.infrastructure.crypto.AeadAes256CbcHmacSha512;
import com.securehealth.infrastructure.crypto.KeyUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class LocalMasterKeyProviderTest {

    private final AeadAes256CbcHmacSha512 cipher = new AeadAes256CbcHmacSha512();

    @TempDir
    Path tempDir;

    @Test
    void inlineKeyTakesPrecedenceOverFile() throws Exception {
        byte[] inline = cipher.generateKey();
        Path file = tempDir.resolve("encryption.key");
        Files.write(file, cipher.generateKey());

        LocalMasterKeyProvider provider = new LocalMasterKeyProvider(
            Base64.getEncoder().encodeToString(inline), file, false, cipher);

        assertArrayEquals(inline, provider.masterKey());
    }

    @Test
    void readsKeyFile() throws Exception {
        byte[] key = cipher.generateKey();
        Path file = tempDir.resolve("encryption.key");
        Files.write(file, key);

        assertArrayEquals(key, new LocalMasterKeyProvider(null, file, false, cipher).masterKey());
    }

    @Test
    void missingKeyFailsClosedUnlessGenerationEnabled() {
        Path file = tempDir.resolve("config").resolve("encryption.key");

        assertThrows(KeyUnavailableException.class,
            () -> new LocalMasterKeyProvider(null, file, false, cipher).masterKey());
        assertFalse(Files.exists(file));
    }

    @Test
    void generatesMissingKeyWhenEnabled() throws Exception {
        Path file = tempDir.resolve("config").resolve("encryption.key");

        byte[] key = new LocalMasterKeyProvider(null, file, true, cipher).masterKey();

        assertEquals(AeadAes256CbcHmacSha512.KEY_LENGTH, key.length);
        assertArrayEquals(key, Files.readAllBytes(file));
        assertArrayEquals(key, new LocalMasterKeyProvider(null, file, true, cipher).masterKey());
    }

    @Test
    void wrongLengthKeyIsNeverReplaced() throws Exception {
        Path file = tempDir.resolve("encryption.key");
        Files.write(file, new byte[32]);

        assertThrows(KeyUnavailableException.class,
            () -> new LocalMasterKeyProvider(null, file, true, cipher).masterKey());
        assertEquals(32, Files.size(file));
    }

    @Test
    void invalidBase64IsRejected() {
        assertThrows(KeyUnavailableException.class,
            () -> new LocalMasterKeyProvider("not base64!", null, false, cipher).masterKey());
    }

    @Test
    void returnsDefensiveCopies() {
        LocalMasterKeyProvider provider = new LocalMasterKeyProvider(
            Base64.getEncoder().encodeToString(cipher.generateKey()), null, false, cipher);

        byte[] first = provider.masterKey();
        first[0] ^= 0x01;

        assertNotEquals(first[0], provider.masterKey()[0]);
    }
}
