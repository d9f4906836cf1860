package com.example.tokenrelay.crypto;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/**
 * Symmetric payload cipher wrapped in an asymmetric transport step.
 *
 * <p>{@code seal} encrypts with the symmetric codec, then wraps that ciphertext with the public
 * key; {@code open} reverses both steps. The symmetric ciphertext, IV included, must fit the
 * transport's size limit (214 bytes for RSA-2048 with OAEP/SHA-1).
 */
public final class HybridCipher {

  private final SymmetricCodec symmetricCodec;
  private final AsymmetricTransport transport;

  public HybridCipher(SymmetricCodec symmetricCodec, AsymmetricTransport transport) {
    this.symmetricCodec = Objects.requireNonNull(symmetricCodec, "symmetricCodec");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  public byte[] seal(byte[] plaintext, PublicKey publicKey) {
    return transport.encrypt(symmetricCodec.encrypt(plaintext), publicKey);
  }

  public byte[] open(byte[] sealed, PrivateKey privateKey) {
    return symmetricCodec.decrypt(transport.decrypt(sealed, privateKey));
  }

  /**
   * The symmetric key wrapped for {@code publicKey}, so the holder of the matching private key
   * can rebuild the codec.
   */
  public byte[] wrappedKey(PublicKey publicKey) {
    return transport.encrypt(symmetricCodec.keyBytes(), publicKey);
  }
}
