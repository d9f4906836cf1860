package com.example.tokenrelay.adapter.authserver;

import com.example.tokenrelay.adapter.authserver.dto.EncryptedEnvelope;
import com.example.tokenrelay.adapter.authserver.dto.SessionExchangeRequest;
import com.example.tokenrelay.crypto.AesCbcCodec;
import com.example.tokenrelay.crypto.AsymmetricTransport;
import com.example.tokenrelay.crypto.HybridCipher;
import com.example.tokenrelay.crypto.RsaOaepTransport;
import com.example.tokenrelay.domain.entity.AuthData;
import com.example.tokenrelay.domain.entity.AuthLookup;
import com.example.tokenrelay.exception.AuthServerException;
import com.example.tokenrelay.exception.EncryptionException;
import com.example.tokenrelay.properties.ApplicationProperties;
import com.example.tokenrelay.security.KeyMaterial;
import com.example.tokenrelay.util.CookieUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Performs the encrypted session exchange with the authentication server.
 *
 * <p>The request carries the session id sealed with a fresh AES key, plus that key wrapped for
 * the server. The server answers with a ZIP archive holding an AES key wrapped for the relay
 * ({@code key}) and the session JSON encrypted under it ({@code session_data}).
 *
 * <p>Not idempotent from the server's point of view and never retried here; callers cache the
 * result per session id.
 */
@Slf4j
@Component
public class AuthServerClient {

  private static final String AUTH_SERVER_BREAKER = "authServer";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final Set<Integer> UNRECOGNIZED_SESSION_STATUSES = Set.of(401, 403, 404);
  private static final TypeReference<Map<String, Object>> SESSION_DATA_TYPE = new TypeReference<>() {};

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final KeyMaterial keyMaterial;
  private final AsymmetricTransport transport;
  private final String exchangeUrl;

  @Autowired
  public AuthServerClient(
      @Qualifier("authServerOkHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      KeyMaterial keyMaterial,
      ApplicationProperties properties) {
    this(httpClient, objectMapper, keyMaterial, new RsaOaepTransport(),
         properties.authServer().url() + properties.authServer().tokenPath());
  }

  AuthServerClient(OkHttpClient httpClient, ObjectMapper objectMapper, KeyMaterial keyMaterial,
                   AsymmetricTransport transport, String exchangeUrl) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.keyMaterial = keyMaterial;
    this.transport = transport;
    this.exchangeUrl = exchangeUrl;
    log.info("Initialized authentication server client for: {}", exchangeUrl);
  }

  /**
   * Runs one exchange for {@code sessionId}.
   *
   * @return the decrypted session data, or a rejection when the server does not know the session
   * @throws AuthServerException on transport failure, unexpected status, malformed archive or
   *     undecryptable payload
   */
  @CircuitBreaker(name = AUTH_SERVER_BREAKER, fallbackMethod = "fetchFallback")
  public AuthLookup fetch(String sessionId) {
    log.debug("Requesting session data from authentication server for session {}",
              CookieUtil.maskSessionId(sessionId));

    Request request = new Request.Builder()
        .url(exchangeUrl)
        .header("Accept", "application/zip")
        .post(RequestBody.create(buildRequestBody(sessionId), JSON))
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      if (UNRECOGNIZED_SESSION_STATUSES.contains(response.code())) {
        log.warn("Authentication server rejected session {} with status {}",
                 CookieUtil.maskSessionId(sessionId), response.code());
        return AuthLookup.rejected(response.code());
      }
      if (!response.isSuccessful()) {
        throw new AuthServerException(
            "Authentication server returned a non-successful status: " + response.code());
      }

      ResponseBody body = response.body();
      if (body == null) {
        throw new AuthServerException("Received an empty response body from the authentication server");
      }

      EncryptedEnvelope envelope = EncryptedEnvelope.fromZip(body.bytes());
      return AuthLookup.found(open(envelope));

    } catch (IOException e) {
      throw new AuthServerException("Session exchange failed due to network error", e);
    }
  }

  /**
   * Fallback for the authServer circuit breaker. Only an open breaker lands here; other failures
   * propagate unchanged.
   */
  public AuthLookup fetchFallback(String sessionId, CallNotPermittedException ex) {
    log.error("Authentication server circuit breaker is OPEN. Failing session {} fast.",
              CookieUtil.maskSessionId(sessionId));
    throw new AuthServerException("Authentication server is temporarily unavailable.", ex);
  }

  private String buildRequestBody(String sessionId) {
    HybridCipher cipher = new HybridCipher(AesCbcCodec.generate(), transport);
    byte[] sealedSessionId = cipher.seal(sessionId.getBytes(StandardCharsets.UTF_8),
                                         keyMaterial.authServerPublicKey());
    byte[] wrappedKey = cipher.wrappedKey(keyMaterial.authServerPublicKey());

    Base64.Encoder encoder = Base64.getEncoder();
    SessionExchangeRequest payload = new SessionExchangeRequest(
        encoder.encodeToString(wrappedKey),
        encoder.encodeToString(sealedSessionId));
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new AuthServerException("Failed to serialize session exchange request", e);
    }
  }

  private AuthData open(EncryptedEnvelope envelope) {
    byte[] plaintext;
    try {
      byte[] sessionKey = transport.decrypt(envelope.key(), keyMaterial.privateKey());
      plaintext = AesCbcCodec.withKey(sessionKey).decrypt(envelope.sessionData());
    } catch (EncryptionException e) {
      throw new AuthServerException("Failed to decrypt session data from authentication server", e);
    }

    try {
      return new AuthData(objectMapper.readValue(plaintext, SESSION_DATA_TYPE));
    } catch (IOException e) {
      throw new AuthServerException("Session data from authentication server is not a JSON object", e);
    }
  }
}
