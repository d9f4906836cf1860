package com.example.tokenrelay.crypto;

import com.example.tokenrelay.exception.EncryptionException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import javax.crypto.Cipher;
import lombok.extern.slf4j.Slf4j;

/**
 * RSA with OAEP padding (SHA-1 / MGF1), the scheme the authentication server speaks.
 */
@Slf4j
public final class RsaOaepTransport implements AsymmetricTransport {

  private static final String TRANSFORMATION = "RSA/ECB/OAEPWithSHA-1AndMGF1Padding";
  // 2 * SHA-1 length + 2
  private static final int OAEP_SHA1_OVERHEAD = 42;

  /**
   * Largest payload one OAEP/SHA-1 block can carry under {@code publicKey}, 0 for non-RSA keys.
   */
  public static int maxPlaintextBytes(PublicKey publicKey) {
    if (!(publicKey instanceof RSAPublicKey rsaKey)) {
      return 0;
    }
    int modulusBytes = (rsaKey.getModulus().bitLength() + 7) / 8;
    return Math.max(0, modulusBytes - OAEP_SHA1_OVERHEAD);
  }

  @Override
  public byte[] encrypt(byte[] data, PublicKey publicKey) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, publicKey);
      return cipher.doFinal(data);
    } catch (GeneralSecurityException e) {
      log.error("RSA-OAEP encryption failed for {} bytes", data == null ? 0 : data.length, e);
      throw new EncryptionException("Failed to wrap data with public key", e);
    }
  }

  @Override
  public byte[] decrypt(byte[] data, PrivateKey privateKey) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, privateKey);
      return cipher.doFinal(data);
    } catch (GeneralSecurityException e) {
      log.debug("RSA-OAEP decryption failed: {}", e.getMessage());
      throw new EncryptionException("Failed to unwrap data with private key", e);
    }
  }
}
