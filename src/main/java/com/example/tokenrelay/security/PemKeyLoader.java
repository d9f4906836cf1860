package com.example.tokenrelay.security;

import com.example.tokenrelay.exception.KeyMaterialException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.security.PrivateKey;
import java.security.PublicKey;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

/**
 * Reads RSA keys from PEM text.
 *
 * Accepts PKCS#1 ({@code RSA PRIVATE KEY}) and PKCS#8 ({@code PRIVATE KEY}) private keys, and
 * X.509 ({@code PUBLIC KEY}) or PKCS#1 ({@code RSA PUBLIC KEY}) public keys.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PemKeyLoader {

  private static final JcaPEMKeyConverter CONVERTER = new JcaPEMKeyConverter();

  public static PrivateKey readPrivateKey(String pem) {
    Object parsed = parse(pem);
    try {
      if (parsed instanceof PEMKeyPair keyPair) {
        return CONVERTER.getPrivateKey(keyPair.getPrivateKeyInfo());
      }
      if (parsed instanceof PrivateKeyInfo privateKeyInfo) {
        return CONVERTER.getPrivateKey(privateKeyInfo);
      }
    } catch (IOException e) {
      throw new KeyMaterialException("Unreadable private key", e);
    }
    throw new KeyMaterialException("PEM does not contain an unencrypted private key: "
                                       + describe(parsed));
  }

  public static PublicKey readPublicKey(String pem) {
    Object parsed = parse(pem);
    try {
      if (parsed instanceof SubjectPublicKeyInfo publicKeyInfo) {
        return CONVERTER.getPublicKey(publicKeyInfo);
      }
      if (parsed instanceof PEMKeyPair keyPair) {
        return CONVERTER.getPublicKey(keyPair.getPublicKeyInfo());
      }
    } catch (IOException e) {
      throw new KeyMaterialException("Unreadable public key", e);
    }
    throw new KeyMaterialException("PEM does not contain a public key: " + describe(parsed));
  }

  private static Object parse(String pem) {
    if (pem == null || pem.isBlank()) {
      throw new KeyMaterialException("PEM content is empty");
    }
    try (Reader reader = new StringReader(pem); PEMParser parser = new PEMParser(reader)) {
      Object parsed = parser.readObject();
      if (parsed == null) {
        throw new KeyMaterialException("No PEM object found");
      }
      return parsed;
    } catch (IOException e) {
      throw new KeyMaterialException("Malformed PEM content", e);
    }
  }

  private static String describe(Object parsed) {
    return parsed == null ? "nothing" : parsed.getClass().getSimpleName();
  }
}
