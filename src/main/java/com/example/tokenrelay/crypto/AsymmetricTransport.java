package com.example.tokenrelay.crypto;

import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Public-key wrapper used to move symmetric artifacts between the relay and the
 * authentication server.
 */
public interface AsymmetricTransport {

  byte[] encrypt(byte[] data, PublicKey publicKey);

  /**
   * @throws com.example.tokenrelay.exception.EncryptionException when {@code data} was not
   *     produced for the key pair of {@code privateKey}
   */
  byte[] decrypt(byte[] data, PrivateKey privateKey);
}
