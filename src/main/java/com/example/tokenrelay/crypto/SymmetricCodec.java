package com.example.tokenrelay.crypto;

/**
 * Symmetric payload cipher. Each instance owns one secret key for its lifetime.
 */
public interface SymmetricCodec {

  /**
   * Encrypts {@code plaintext}. The output carries everything except the key that
   * {@link #decrypt(byte[])} needs, including the per-message IV.
   */
  byte[] encrypt(byte[] plaintext);

  /**
   * Reverses {@link #encrypt(byte[])}.
   *
   * @throws com.example.tokenrelay.exception.EncryptionException on malformed input or bad padding
   */
  byte[] decrypt(byte[] ciphertext);

  /**
   * Raw key bytes, for wrapping with an {@link AsymmetricTransport}.
   */
  byte[] keyBytes();
}
