package com.example.tokenrelay.adapter.authserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body posted to the authentication server. Both values are Base64.
 */
public record SessionExchangeRequest(
    //AES key wrapped with the server's RSA public key.
    @JsonProperty("key")
    String key,
    //Session id, AES-encrypted and then wrapped with the server's RSA public key.
    @JsonProperty("session_id")
    String sessionId
) {}
