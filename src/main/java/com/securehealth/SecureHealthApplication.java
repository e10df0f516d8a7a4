package com.securehealth;

import com.securehealth.config.PhiEncryptionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Main application class for the SecureHealth PHI subsystem.
 *
 * <p>Security features:
 *
 * <ul>
 *   <li><strong>Field-Level Encryption</strong>: AEAD_AES_256_CBC_HMAC_SHA_512, deterministic for
 *       searchable fields and randomized for everything else sensitive</li>
 *   <li><strong>Key Vault</strong>: data keys wrapped under a local master key, created lazily
 *       and race-safe through a unique alt name index</li>
 *   <li><strong>Schema Tolerance</strong>: legacy unencrypted records load side by side with encrypted ones</li>
 *   <li><strong>Role Projection</strong>: allow-list views per role, audited on every read</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class SecureHealthApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SecureHealthApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = application.run(args);

        PhiEncryptionProperties encryption = context.getBean(PhiEncryptionProperties.class);
        log.info("""
            ╔═══════════════════════════════════════════════════════════╗
            ║  SecureHealth PHI Subsystem                               ║
            ║  Encryption mode: {}
            ║  Data key: {}
            ║  Cipher: AEAD_AES_256_CBC_HMAC_SHA_512                    ║
            ╚═══════════════════════════════════════════════════════════╝
            """, encryption.getMode(), encryption.getKeyAltName());
    }
}
