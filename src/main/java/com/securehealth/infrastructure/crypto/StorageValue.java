package com.securehealth.infrastructure.crypto;

import com.securehealth.domain.model.FieldValue;

import java.util.Objects;

/**
 * A field value as found at rest, classified once at the storage boundary.
 *
 * <ul>
 *   <li>{@link Plain}: stored unencrypted (no policy, or written in documentation mode)</li>
 *   <li>{@link Cipher}: an encrypted {@link CipherValue}</li>
 *   <li>{@link LegacyComposite}: a native list or map written before the field was encrypted</li>
 * </ul>
 */
public sealed interface StorageValue permits StorageValue.Plain, StorageValue.Cipher, StorageValue.LegacyComposite {

    record Plain(FieldValue value) implements StorageValue {
        public Plain {
            Objects.requireNonNull(value, "value");
        }
    }

    record Cipher(CipherValue value) implements StorageValue {
        public Cipher {
            Objects.requireNonNull(value, "value");
        }
    }

    record LegacyComposite(FieldValue.Composite value) implements StorageValue {
        public LegacyComposite {
            Objects.requireNonNull(value, "value");
        }
    }
}
