package com.securehealth.infrastructure.keyvault;

import com.securehealth.infrastructure.crypto.AeadAes256CbcHmacSha512;
import com.securehealth.infrastructure.crypto.KeyUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;

/**
 * Master key held locally: inline base64 configuration first, then a key file.
 *
 * <p>A key of the wrong length is always rejected; it is never replaced, since replacing it would
 * orphan every data key wrapped under the old one. A missing key file is generated only when
 * explicitly enabled.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
public class LocalMasterKeyProvider implements MasterKeyProvider {

    public static final String PROVIDER_NAME = "local";

    private final String base64Key;
    private final Path keyPath;
    private final boolean generateIfMissing;
    private final AeadAes256CbcHmacSha512 cipher;

    private volatile byte[] cachedKey;

    public LocalMasterKeyProvider(String base64Key, Path keyPath, boolean generateIfMissing,
                                  AeadAes256CbcHmacSha512 cipher) {
        this.base64Key = base64Key;
        this.keyPath = keyPath;
        this.generateIfMissing = generateIfMissing;
        this.cipher = cipher;
    }

    @Override
    public byte[] masterKey() {
        byte[] key = cachedKey;
        if (key == null) {
            synchronized (this) {
                key = cachedKey;
                if (key == null) {
                    key = load();
                    cachedKey = key;
                }
            }
        }
        return key.clone();
    }

    @Override
    public String providerName() {
        return PROVIDER_NAME;
    }

    private byte[] load() {
        if (base64Key != null && !base64Key.isBlank()) {
            byte[] key;
            try {
                key = Base64.getDecoder().decode(base64Key.trim());
            } catch (IllegalArgumentException e) {
                throw new KeyUnavailableException("Configured master key is not valid base64", e);
            }
            log.info("Using master key from configuration");
            return checkLength(key, "configuration");
        }
        if (keyPath == null) {
            throw new KeyUnavailableException("No master key configured");
        }
        if (Files.exists(keyPath)) {
            try {
                byte[] key = Files.readAllBytes(keyPath);
                log.info("Loaded master key from {}", keyPath);
                return checkLength(key, keyPath.toString());
            } catch (IOException e) {
                throw new KeyUnavailableException("Master key file could not be read: " + keyPath, e);
            }
        }
        if (!generateIfMissing) {
            throw new KeyUnavailableException("Master key file not found: " + keyPath);
        }
        return generate();
    }

    private byte[] generate() {
        byte[] key = cipher.generateKey();
        try {
            Path parent = keyPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(keyPath, key, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new KeyUnavailableException("Master key could not be written to " + keyPath, e);
        }
        log.warn("Generated new master key at {}; back it up, data keys cannot be recovered without it", keyPath);
        return key;
    }

    private static byte[] checkLength(byte[] key, String source) {
        if (key.length != AeadAes256CbcHmacSha512.KEY_LENGTH) {
            throw new KeyUnavailableException("Master key from " + source + " must be "
                + AeadAes256CbcHmacSha512.KEY_LENGTH + " bytes but was " + key.length);
        }
        return key;
    }
}
