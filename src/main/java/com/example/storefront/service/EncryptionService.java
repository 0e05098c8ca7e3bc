package com.example.storefront.service;

import com.example.storefront.exception.EncryptionException;
import com.example.storefront.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Centralized Encryption Service
 *
 * AES-256-GCM for the primary credential store, keyed from {@code app.credentials.primary.encryption-key}.
 * Ciphertext layout is base64(IV || ciphertext+tag).
 */
@Slf4j
@Service
public class EncryptionService {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final int KEY_LENGTH_BYTES = 32;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final SecretKey currentKey;

  public EncryptionService(ApplicationProperties properties) {
    this.currentKey = loadEncryptionKey(properties.credentials().primary().encryptionKey());
  }

  /**
   * Whether a fixed key is configured. Without one, nothing stored can be decrypted.
   */
  public boolean isConfigured() {
    return currentKey != null;
  }

  /**
   * Encrypt data using AES-256-GCM
   */
  public String encrypt(String plaintext) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      GCMParameterSpec spec = new GCMParameterSpec(GCM_TAG_LENGTH, iv);
      cipher.init(Cipher.ENCRYPT_MODE, requireKey(), spec);

      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Base64.getEncoder().encodeToString(combined);

    } catch (EncryptionException e) {
      throw e;
    } catch (Exception e) {
      log.error("Encryption failed", e);
      throw new EncryptionException("Failed to encrypt data", e);
    }
  }

  /**
   * Decrypt data using AES-256-GCM
   */
  public String decrypt(String encryptedData) {
    try {
      byte[] combined = Base64.getDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        throw new EncryptionException("Encrypted payload is too short");
      }

      byte[] iv = new byte[GCM_IV_LENGTH];
      byte[] encrypted = new byte[combined.length - GCM_IV_LENGTH];
      System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH);
      System.arraycopy(combined, GCM_IV_LENGTH, encrypted, 0, encrypted.length);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      GCMParameterSpec spec = new GCMParameterSpec(GCM_TAG_LENGTH, iv);
      cipher.init(Cipher.DECRYPT_MODE, requireKey(), spec);

      byte[] decrypted = cipher.doFinal(encrypted);
      return new String(decrypted, StandardCharsets.UTF_8);

    } catch (EncryptionException e) {
      throw e;
    } catch (Exception e) {
      throw new EncryptionException("Failed to decrypt data", e);
    }
  }

  private SecretKey requireKey() {
    if (currentKey == null) {
      throw new EncryptionException("No credential encryption key is configured");
    }
    return currentKey;
  }

  private static SecretKey loadEncryptionKey(String keyBase64) {
    if (keyBase64 == null || keyBase64.isBlank()) {
      log.warn("No credential encryption key configured; primary-store records cannot be decrypted");
      return null;
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(keyBase64.trim());
    } catch (IllegalArgumentException e) {
      throw new EncryptionException("Credential encryption key is not valid base64", e);
    }
    if (keyBytes.length != KEY_LENGTH_BYTES) {
      throw new EncryptionException("Invalid key length: expected 256 bits");
    }
    log.info("Credential encryption key loaded");
    return new SecretKeySpec(keyBytes, "AES");
  }
}
