package com.warmlead.crm.sync.config;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * JPA AttributeConverter encrypting the stored Pipedrive API key at rest (AES-GCM).
 * 
 * Stored format: Base64(iv || ciphertext). Values that fail to decrypt are returned
 * as-is so keys written before encryption was enabled keep working until re-saved.
 * 
 * To enable encryption, set: encryption.enabled=true and encryption.key=<base64-key>
 * To generate a key: EncryptedStringAttributeConverter.generateEncryptionKey()
 */
@Converter
@Slf4j
public class EncryptedStringAttributeConverter implements AttributeConverter<String, String> {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_SIZE = 256;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final SecureRandom RANDOM = new SecureRandom();

    private static volatile SecretKey secretKey;
    private static volatile boolean encryptionEnabled = false;

    /**
     * Initialize the converter with the key from configuration.
     * Called by EncryptionConfig during startup; JPA instantiates converters itself.
     */
    public static void initialize(String encryptionKey, boolean enabled) {
        encryptionEnabled = enabled;
        secretKey = null;

        if (!enabled) {
            log.info("Encryption is disabled - API keys will be stored in plaintext");
            return;
        }

        if (encryptionKey == null || encryptionKey.trim().isEmpty()) {
            log.warn("Encryption enabled but no key provided - falling back to plaintext storage");
            encryptionEnabled = false;
            return;
        }

        try {
            byte[] keyBytes = Base64.getDecoder().decode(encryptionKey.trim());
            secretKey = new SecretKeySpec(keyBytes, ALGORITHM);
            log.info("Encryption initialized successfully");
        } catch (IllegalArgumentException e) {
            log.error("Failed to initialize encryption key", e);
            encryptionEnabled = false;
        }
    }

    /**
     * Generate a new Base64-encoded AES key (for initial setup).
     */
    public static String generateEncryptionKey() {
        try {
            KeyGenerator keyGenerator = KeyGenerator.getInstance(ALGORITHM);
            keyGenerator.init(KEY_SIZE, RANDOM);
            return Base64.getEncoder().encodeToString(keyGenerator.generateKey().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate encryption key", e);
        }
    }

    @Override
    public String convertToDatabaseColumn(String attribute) {
        if (attribute == null || !encryptionEnabled || secretKey == null) {
            return attribute;
        }

        try {
            byte[] iv = new byte[IV_LENGTH];
            RANDOM.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] encrypted = cipher.doFinal(attribute.getBytes(StandardCharsets.UTF_8));
            byte[] stored = ByteBuffer.allocate(iv.length + encrypted.length).put(iv).put(encrypted).array();
            return Base64.getEncoder().encodeToString(stored);
        } catch (GeneralSecurityException e) {
            log.error("Failed to encrypt attribute value", e);
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    @Override
    public String convertToEntityAttribute(String dbData) {
        if (dbData == null || !encryptionEnabled || secretKey == null) {
            return dbData;
        }

        try {
            byte[] stored = Base64.getDecoder().decode(dbData);
            if (stored.length <= IV_LENGTH) {
                return dbData;
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, stored, 0, IV_LENGTH));
            byte[] decrypted = cipher.doFinal(stored, IV_LENGTH, stored.length - IV_LENGTH);
            return new String(decrypted, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            // Plaintext written before encryption was enabled
            log.debug("Decryption failed, assuming plaintext value: {}", e.getMessage());
            return dbData;
        }
    }
}
