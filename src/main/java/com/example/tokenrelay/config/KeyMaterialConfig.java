package com.example.tokenrelay.config;

import com.example.tokenrelay.crypto.AesCbcCodec;
import com.example.tokenrelay.exception.KeyMaterialException;
import com.example.tokenrelay.properties.ApplicationProperties;
import com.example.tokenrelay.security.KeyMaterial;
import com.example.tokenrelay.security.PemKeyLoader;
import com.example.tokenrelay.util.CookieUtil;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the RSA key pair used for the authentication server exchange, once, at startup.
 * A missing or unreadable key fails the application context.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class KeyMaterialConfig {

  @Bean
  public KeyMaterial keyMaterial(ApplicationProperties properties, ResourceLoader resourceLoader) {
    ApplicationProperties.KeyProperties keys = properties.keys();
    KeyMaterial keyMaterial = new KeyMaterial(
        PemKeyLoader.readPrivateKey(readPem(resourceLoader, keys.privateKeyPath())),
        PemKeyLoader.readPublicKey(readPem(resourceLoader, keys.authServerPublicKeyPath())));
    requireSealableSessionIds(keyMaterial);
    log.info("Key material loaded: {}", keyMaterial);
    return keyMaterial;
  }

  // The sealed session id must fit one RSA-OAEP block of the server key.
  static void requireSealableSessionIds(KeyMaterial keyMaterial) {
    if (!keyMaterial.canSeal(CookieUtil.MAX_SESSION_ID_BYTES)) {
      throw new KeyMaterialException(String.format(
          "Auth server public key can wrap at most %d bytes, but a %d byte session id seals to %d bytes",
          keyMaterial.maxSealableBytes(), CookieUtil.MAX_SESSION_ID_BYTES,
          AesCbcCodec.ciphertextLength(CookieUtil.MAX_SESSION_ID_BYTES)));
    }
  }

  private String readPem(ResourceLoader resourceLoader, String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new KeyMaterialException("Key file not found: " + location);
    }
    try (InputStream in = resource.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new KeyMaterialException("Failed to read key file: " + location, e);
    }
  }
}
