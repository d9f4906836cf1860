package com.example.tokenrelay.crypto;

import com.example.tokenrelay.exception.EncryptionException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;

/**
 * AES-CBC with PKCS#5 padding.
 *
 * Output layout: 16-byte random IV followed by the ciphertext.
 */
@Slf4j
public final class AesCbcCodec implements SymmetricCodec {

  private static final String ALGORITHM = "AES";
  private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
  private static final int IV_LENGTH = 16;
  private static final int BLOCK_SIZE = 16;
  private static final int KEY_SIZE_BITS = 256;
  private static final SecureRandom secureRandom = new SecureRandom();

  private final SecretKey key;

  private AesCbcCodec(SecretKey key) {
    this.key = key;
  }

  /**
   * Output size of {@link #encrypt} for a plaintext of {@code plaintextLength} bytes.
   */
  public static int ciphertextLength(int plaintextLength) {
    return IV_LENGTH + (plaintextLength / BLOCK_SIZE + 1) * BLOCK_SIZE;
  }

  /**
   * Codec with a freshly generated 256-bit key.
   */
  public static AesCbcCodec generate() {
    try {
      KeyGenerator generator = KeyGenerator.getInstance(ALGORITHM);
      generator.init(KEY_SIZE_BITS, secureRandom);
      return new AesCbcCodec(generator.generateKey());
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to generate AES key", e);
    }
  }

  /**
   * Codec over existing key material (16, 24 or 32 bytes).
   */
  public static AesCbcCodec withKey(byte[] keyBytes) {
    if (keyBytes == null
        || (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32)) {
      throw new EncryptionException("Invalid AES key length: "
                                        + (keyBytes == null ? "null" : keyBytes.length + " bytes"));
    }
    return new AesCbcCodec(new SecretKeySpec(keyBytes, ALGORITHM));
  }

  @Override
  public byte[] encrypt(byte[] plaintext) {
    try {
      byte[] iv = new byte[IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
      byte[] encrypted = cipher.doFinal(plaintext);

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
      return combined;

    } catch (GeneralSecurityException e) {
      log.error("AES encryption failed", e);
      throw new EncryptionException("Failed to encrypt data", e);
    }
  }

  @Override
  public byte[] decrypt(byte[] ciphertext) {
    if (ciphertext == null || ciphertext.length < IV_LENGTH + BLOCK_SIZE
        || (ciphertext.length - IV_LENGTH) % BLOCK_SIZE != 0) {
      throw new EncryptionException("Ciphertext is not a whole number of AES blocks after the IV");
    }
    try {
      byte[] iv = new byte[IV_LENGTH];
      byte[] encrypted = new byte[ciphertext.length - IV_LENGTH];
      System.arraycopy(ciphertext, 0, iv, 0, IV_LENGTH);
      System.arraycopy(ciphertext, IV_LENGTH, encrypted, 0, encrypted.length);

      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(iv));
      return cipher.doFinal(encrypted);

    } catch (GeneralSecurityException e) {
      log.debug("AES decryption failed: {}", e.getMessage());
      throw new EncryptionException("Failed to decrypt data", e);
    }
  }

  @Override
  public byte[] keyBytes() {
    return key.getEncoded();
  }
}
