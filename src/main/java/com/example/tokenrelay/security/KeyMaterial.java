package com.example.tokenrelay.security;

import com.example.tokenrelay.crypto.AesCbcCodec;
import com.example.tokenrelay.crypto.RsaOaepTransport;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/**
 * Process-wide RSA key material, loaded once at startup and shared read-only.
 *
 * @param privateKey relay private key, unwraps the symmetric key sent back by the server
 * @param authServerPublicKey wraps the request payload for the authentication server
 */
public record KeyMaterial(PrivateKey privateKey, PublicKey authServerPublicKey) {

  public KeyMaterial {
    Objects.requireNonNull(privateKey, "privateKey");
    Objects.requireNonNull(authServerPublicKey, "authServerPublicKey");
  }

  /**
   * Largest payload the server public key can wrap in one block.
   */
  public int maxSealableBytes() {
    return RsaOaepTransport.maxPlaintextBytes(authServerPublicKey);
  }

  /**
   * Whether a plaintext of {@code plaintextBytes} still fits after AES expansion.
   */
  public boolean canSeal(int plaintextBytes) {
    return AesCbcCodec.ciphertextLength(plaintextBytes) <= maxSealableBytes();
  }

  @Override
  public String toString() {
    return "KeyMaterial[privateKey=" + privateKey.getAlgorithm()
        + ", authServerPublicKey=" + authServerPublicKey.getAlgorithm() + "]";
  }
}
